package io.hmis.backend.multitenancy;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Tenant directory in the shared {@code public} schema. */
@Repository
public class TenantRepository {

  private final JdbcClient jdbc;

  public TenantRepository(@Qualifier("appDataSource") DataSource dataSource) {
    this.jdbc = JdbcClient.create(dataSource);
  }

  public Optional<String> findActiveSchema(String tenantId) {
    return jdbc.sql(
            "SELECT schema_name FROM public.tenants WHERE tenant_id = ? AND is_active = true")
        .param(tenantId)
        .query(String.class)
        .optional();
  }

  public Optional<TenantRecord> findByTenantId(String tenantId) {
    return jdbc.sql(
            """
            SELECT tenant_id, schema_name, name, is_active, created_at
            FROM public.tenants WHERE tenant_id = ?
            """)
        .param(tenantId)
        .query(
            (rs, rowNum) ->
                new TenantRecord(
                    rs.getString("tenant_id"),
                    rs.getString("schema_name"),
                    rs.getString("name"),
                    rs.getBoolean("is_active"),
                    rs.getTimestamp("created_at").toInstant()))
        .optional();
  }

  public List<TenantRecord> findAllActive() {
    return jdbc.sql(
            """
            SELECT tenant_id, schema_name, name, is_active, created_at
            FROM public.tenants WHERE is_active = true ORDER BY created_at
            """)
        .query(
            (rs, rowNum) ->
                new TenantRecord(
                    rs.getString("tenant_id"),
                    rs.getString("schema_name"),
                    rs.getString("name"),
                    rs.getBoolean("is_active"),
                    rs.getTimestamp("created_at").toInstant()))
        .list();
  }

  /** Returns {@code true} if a new row was written. */
  public boolean insertIfAbsent(String tenantId, String schemaName, String name) {
    int rows =
        jdbc.sql(
                """
                INSERT INTO public.tenants (tenant_id, schema_name, name, is_active, created_at)
                VALUES (?, ?, ?, true, ?)
                ON CONFLICT (tenant_id) DO NOTHING
                """)
            .params(tenantId, schemaName, name, new Timestamp(System.currentTimeMillis()))
            .update();
    return rows == 1;
  }

  public int setActive(String tenantId, boolean active) {
    return jdbc.sql("UPDATE public.tenants SET is_active = ? WHERE tenant_id = ?")
        .params(active, tenantId)
        .update();
  }
}
