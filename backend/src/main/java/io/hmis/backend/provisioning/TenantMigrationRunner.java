package io.hmis.backend.provisioning;

import io.hmis.backend.multitenancy.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Brings every active tenant schema up to the latest tenant migration at startup. */
@Component
public class TenantMigrationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrationRunner.class);

  private final TenantRepository tenantRepository;
  private final TenantSchemaMigrator schemaMigrator;

  public TenantMigrationRunner(
      TenantRepository tenantRepository, TenantSchemaMigrator schemaMigrator) {
    this.tenantRepository = tenantRepository;
    this.schemaMigrator = schemaMigrator;
  }

  @Override
  public void run(ApplicationArguments args) {
    var tenants = tenantRepository.findAllActive();
    if (tenants.isEmpty()) {
      log.info("No tenant schemas found, skipping per-tenant migrations");
      return;
    }

    log.info("Running tenant migrations for {} schemas", tenants.size());
    for (var tenant : tenants) {
      try {
        schemaMigrator.migrate(tenant.schemaName());
      } catch (Exception e) {
        log.error("Failed to migrate schema {}", tenant.schemaName(), e);
      }
    }
    log.info("Tenant migration runner completed");
  }
}
