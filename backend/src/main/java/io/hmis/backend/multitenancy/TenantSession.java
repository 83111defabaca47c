package io.hmis.backend.multitenancy;

import java.sql.Connection;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * One schema-bound connection for the duration of a unit of work. Owned by {@link
 * TenantSessionProvider}, which commits, rolls back and releases it; callers must not close it.
 */
public class TenantSession {

  private final TenantContext context;
  private final Connection connection;
  private final boolean readOnly;
  private JdbcClient jdbc;

  TenantSession(TenantContext context, Connection connection, boolean readOnly) {
    this.context = context;
    this.connection = connection;
    this.readOnly = readOnly;
  }

  public TenantContext context() {
    return context;
  }

  public String schemaName() {
    return context.schemaName();
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public JdbcClient jdbc() {
    if (jdbc == null) {
      jdbc = JdbcClient.create(new SingleConnectionDataSource(connection, true));
    }
    return jdbc;
  }
}
