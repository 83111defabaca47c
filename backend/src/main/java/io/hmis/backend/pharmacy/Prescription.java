package io.hmis.backend.pharmacy;

import java.util.UUID;

public record Prescription(
    UUID id,
    UUID patientId,
    String medicationName,
    int quantityPrescribed,
    int quantityDispensed,
    String status) {

  static final String STATUS_ACTIVE = "active";
  static final String STATUS_COMPLETED = "completed";

  public int remaining() {
    return quantityPrescribed - quantityDispensed;
  }

  public boolean isActive() {
    return STATUS_ACTIVE.equals(status);
  }
}
