package io.hmis.backend.provisioning;

import io.hmis.backend.multitenancy.SchemaRoutedConnectionProvider;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Creates tenant schemas and applies the tenant migrations to them. Both steps are idempotent. */
@Component
public class TenantSchemaMigrator {

  private static final Logger log = LoggerFactory.getLogger(TenantSchemaMigrator.class);

  private final DataSource migrationDataSource;

  public TenantSchemaMigrator(@Qualifier("migrationDataSource") DataSource migrationDataSource) {
    this.migrationDataSource = migrationDataSource;
  }

  public void createSchema(String schemaName) throws SQLException {
    String safe = SchemaRoutedConnectionProvider.sanitizeSchema(schemaName);
    try (var conn = migrationDataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS \"" + safe + "\"");
      log.info("Ensured schema {} exists", safe);
    }
  }

  public int migrate(String schemaName) {
    var result =
        Flyway.configure()
            .dataSource(migrationDataSource)
            .locations("classpath:db/migration/tenant")
            .schemas(SchemaRoutedConnectionProvider.sanitizeSchema(schemaName))
            .baselineOnMigrate(true)
            .load()
            .migrate();
    log.info("Migrated schema {}: {} migrations applied", schemaName, result.migrationsExecuted);
    return result.migrationsExecuted;
  }
}
