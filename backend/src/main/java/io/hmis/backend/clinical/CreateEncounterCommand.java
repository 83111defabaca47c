package io.hmis.backend.clinical;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

public record CreateEncounterCommand(
    @NotNull UUID patientId,
    @NotNull UUID providerId,
    @NotBlank @Size(max = 30) String encounterType,
    @Size(max = 1000) String reason,
    Instant startDatetime) {}
