package io.hmis.backend.clinical;

import java.time.Instant;
import java.util.UUID;

public record Encounter(
    UUID id,
    UUID patientId,
    UUID providerId,
    String encounterType,
    String reason,
    String status,
    Instant startDatetime) {}
