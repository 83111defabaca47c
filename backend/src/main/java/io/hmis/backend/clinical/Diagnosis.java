package io.hmis.backend.clinical;

import java.util.UUID;

public record Diagnosis(
    UUID id,
    UUID encounterId,
    UUID patientId,
    String icd10Code,
    String description,
    boolean primary) {}
