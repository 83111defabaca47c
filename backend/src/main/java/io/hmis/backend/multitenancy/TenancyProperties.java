package io.hmis.backend.multitenancy;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tenant resolution settings.
 *
 * @param header request header carrying an explicit tenant identifier
 * @param subdomainEnabled whether the leftmost host label may identify the tenant
 * @param reservedLabels host labels that never identify a tenant
 * @param publicPaths path prefixes served without a tenant
 */
@ConfigurationProperties(prefix = "hmis.tenancy")
public record TenancyProperties(
    @DefaultValue("X-Tenant-ID") String header,
    @DefaultValue("true") boolean subdomainEnabled,
    @DefaultValue({"www", "api", "admin"}) List<String> reservedLabels,
    @DefaultValue({"/health", "/actuator/", "/api/docs", "/api/redoc", "/api/auth/", "/internal/"})
        List<String> publicPaths) {}
