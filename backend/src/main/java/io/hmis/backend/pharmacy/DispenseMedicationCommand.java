package io.hmis.backend.pharmacy;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record DispenseMedicationCommand(
    @Positive int quantityDispensed, @NotNull UUID dispensedBy, @Size(max = 1000) String notes) {}
