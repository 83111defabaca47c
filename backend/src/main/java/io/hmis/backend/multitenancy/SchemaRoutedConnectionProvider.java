package io.hmis.backend.multitenancy;

import io.hmis.backend.exception.InvalidTenantSchemaException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands out connections whose {@code search_path} resolves unqualified table names against one
 * tenant schema first and the shared {@code public} schema second.
 */
@Component
public class SchemaRoutedConnectionProvider {

  private static final Logger log = LoggerFactory.getLogger(SchemaRoutedConnectionProvider.class);

  private static final Pattern SCHEMA_PATTERN = Pattern.compile("^tenant_[a-z0-9_]{1,56}$");

  public Connection getConnection(DataSource dataSource, String schema) throws SQLException {
    String sanitized = sanitizeSchema(schema);
    Connection connection = dataSource.getConnection();
    try {
      setSearchPath(connection, sanitized);
      verifySchema(connection, sanitized);
    } catch (SQLException | RuntimeException e) {
      // Release connection on setup failure to prevent pool leak
      connection.close();
      throw e;
    }
    return connection;
  }

  public void releaseConnection(Connection connection) throws SQLException {
    try {
      resetSearchPath(connection);
    } finally {
      connection.close();
    }
  }

  static String searchPathFor(String schema) {
    return TenantContext.DEFAULT_SCHEMA.equals(schema)
        ? TenantContext.DEFAULT_SCHEMA
        : schema + ", " + TenantContext.DEFAULT_SCHEMA;
  }

  public static String sanitizeSchema(String schema) {
    if (schema != null
        && (TenantContext.DEFAULT_SCHEMA.equals(schema)
            || SCHEMA_PATTERN.matcher(schema).matches())) {
      return schema;
    }
    throw new InvalidTenantSchemaException(
        String.valueOf(schema), new IllegalArgumentException("Invalid schema name: " + schema));
  }

  private void setSearchPath(Connection connection, String schema) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("SET search_path TO " + searchPathFor(schema));
    }
  }

  /**
   * Postgres silently skips search_path entries that do not exist, so a dropped tenant schema would
   * fall through to {@code public}. current_schema() reports the first schema that does exist.
   */
  private void verifySchema(Connection connection, String schema) throws SQLException {
    if (TenantContext.DEFAULT_SCHEMA.equals(schema)) {
      return;
    }
    try (var stmt = connection.createStatement();
        var rs = stmt.executeQuery("SELECT current_schema()")) {
      String effective = rs.next() ? rs.getString(1) : null;
      if (!schema.equals(effective)) {
        log.error("Tenant schema missing: expected={}, effective={}", schema, effective);
        throw new InvalidTenantSchemaException(
            schema, new IllegalStateException("Effective schema is " + effective));
      }
    }
  }

  private void resetSearchPath(Connection connection) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("SET search_path TO " + TenantContext.DEFAULT_SCHEMA);
    }
  }
}
