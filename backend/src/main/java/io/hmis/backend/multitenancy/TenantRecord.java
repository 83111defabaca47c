package io.hmis.backend.multitenancy;

import java.time.Instant;

public record TenantRecord(
    String tenantId, String schemaName, String name, boolean active, Instant createdAt) {}
