package io.hmis.backend.pharmacy;

import java.time.Instant;
import java.util.UUID;

public record DispensationRecord(
    UUID id,
    UUID prescriptionId,
    int quantityDispensed,
    UUID dispensedBy,
    Instant dispensedAt,
    String notes) {}
