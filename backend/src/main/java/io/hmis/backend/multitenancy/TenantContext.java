package io.hmis.backend.multitenancy;

import java.util.Objects;

/**
 * Request-scoped tenant binding. Created once by {@link TenantFilter} at the top of the request and
 * passed explicitly to the session provider, command handlers and query handlers; never stored in
 * thread-bound state.
 *
 * <p>A context without a tenant (public routes) is bound to the shared {@code public} schema.
 */
public record TenantContext(String tenantId, String schemaName) {

  public static final String DEFAULT_SCHEMA = "public";

  /** Request attribute under which the filter exposes the context for the current request. */
  public static final String REQUEST_ATTRIBUTE = TenantContext.class.getName();

  private static final TenantContext NONE = new TenantContext(null, DEFAULT_SCHEMA);

  public TenantContext {
    Objects.requireNonNull(schemaName, "schemaName");
    if (tenantId != null && tenantId.isBlank()) {
      throw new IllegalArgumentException("Tenant ID must not be blank");
    }
  }

  public static TenantContext none() {
    return NONE;
  }

  public static TenantContext of(String tenantId, String schemaName) {
    Objects.requireNonNull(tenantId, "tenantId");
    return new TenantContext(tenantId, schemaName);
  }

  public boolean hasTenant() {
    return tenantId != null;
  }

  /** Returns the tenant ID. Throws if this context was bound for a public route. */
  public String requireTenantId() {
    if (tenantId == null) {
      throw new IllegalStateException("Tenant context not available: no tenant bound");
    }
    return tenantId;
  }
}
