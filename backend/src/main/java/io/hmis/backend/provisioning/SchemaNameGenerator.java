package io.hmis.backend.provisioning;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a tenant's schema name from its identifier: {@code tenant_} plus the identifier in lower
 * case with every character outside {@code [a-z0-9]} replaced by {@code _}. {@code clinic-a} maps
 * to {@code tenant_clinic_a}.
 */
public final class SchemaNameGenerator {

  static final String PREFIX = "tenant_";
  static final int MAX_TENANT_ID_LENGTH = 56;

  private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
  private static final Pattern UNSAFE = Pattern.compile("[^a-z0-9]");

  private SchemaNameGenerator() {}

  /**
   * Tenant identifiers are case-insensitive and stored in lower case, the form subdomain resolution
   * produces.
   */
  public static String normalizeTenantId(String tenantId) {
    return tenantId == null ? null : tenantId.trim().toLowerCase(Locale.ROOT);
  }

  public static String generateSchemaName(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("Tenant ID must not be null or blank");
    }
    if (tenantId.length() > MAX_TENANT_ID_LENGTH || !TENANT_ID.matcher(tenantId).matches()) {
      throw new IllegalArgumentException("Invalid tenant ID: " + tenantId);
    }
    return PREFIX + UNSAFE.matcher(tenantId.toLowerCase(Locale.ROOT)).replaceAll("_");
  }
}
