package io.hmis.backend.clinical;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record AddDiagnosisCommand(
    @NotBlank @Pattern(regexp = "^[A-Z][0-9][0-9A-Z](\\.[0-9A-Z]{1,4})?$") String icd10Code,
    @NotBlank @Size(max = 500) String description,
    boolean primary) {}
