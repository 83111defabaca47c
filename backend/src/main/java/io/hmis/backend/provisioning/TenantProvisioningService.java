package io.hmis.backend.provisioning;

import io.hmis.backend.exception.ResourceConflictException;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.TenantFilter;
import io.hmis.backend.multitenancy.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

@Service
public class TenantProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioningService.class);

  private final TenantRepository tenantRepository;
  private final TenantSchemaMigrator schemaMigrator;
  private final TenantFilter tenantFilter;

  public TenantProvisioningService(
      TenantRepository tenantRepository,
      TenantSchemaMigrator schemaMigrator,
      TenantFilter tenantFilter) {
    this.tenantRepository = tenantRepository;
    this.schemaMigrator = schemaMigrator;
    this.tenantFilter = tenantFilter;
  }

  /**
   * Creates the tenant's schema, migrates it and registers the tenant. Every step is idempotent, so
   * a failed attempt can be retried. The directory row is written last, so requests only resolve
   * to the schema once its tables exist. The identifier is stored in lower case.
   */
  @Retryable(
      retryFor = ProvisioningException.class,
      noRetryFor = {IllegalArgumentException.class, ResourceConflictException.class},
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2))
  public ProvisioningResult provisionTenant(String requestedTenantId, String name) {
    String tenantId = SchemaNameGenerator.normalizeTenantId(requestedTenantId);
    String schemaName = SchemaNameGenerator.generateSchemaName(tenantId);

    var existing = tenantRepository.findByTenantId(tenantId);
    if (existing.isPresent()) {
      log.info("Tenant already provisioned: tenantId={}", tenantId);
      return ProvisioningResult.alreadyProvisioned(existing.get().schemaName());
    }

    log.info("Provisioning tenant: tenantId={}, schema={}", tenantId, schemaName);
    try {
      schemaMigrator.createSchema(schemaName);
      schemaMigrator.migrate(schemaName);
    } catch (Exception e) {
      log.error("Failed to provision tenant: tenantId={}", tenantId, e);
      throw new ProvisioningException("Provisioning failed for tenant " + tenantId, e);
    }

    try {
      if (!tenantRepository.insertIfAbsent(tenantId, schemaName, name)) {
        return ProvisioningResult.alreadyProvisioned(schemaName);
      }
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Schema already assigned",
          "Schema " + schemaName + " already belongs to another tenant",
          e);
    }
    tenantFilter.evictSchema(tenantId);
    log.info("Provisioned tenant: tenantId={}, schema={}", tenantId, schemaName);
    return ProvisioningResult.success(schemaName);
  }

  /** Stops routing requests to the tenant. Its schema and data are kept. */
  public void deactivateTenant(String requestedTenantId) {
    String tenantId = SchemaNameGenerator.normalizeTenantId(requestedTenantId);
    if (tenantRepository.setActive(tenantId, false) == 0) {
      throw new ResourceNotFoundException("Tenant", tenantId);
    }
    tenantFilter.evictSchema(tenantId);
    log.info("Deactivated tenant: tenantId={}", tenantId);
  }
}
