package io.hmis.backend.projection;

public record DiagnosisCount(String icd10Code, long count) {}
