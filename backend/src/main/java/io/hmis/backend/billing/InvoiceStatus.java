package io.hmis.backend.billing;

public enum InvoiceStatus {
  PENDING,
  PARTIAL,
  PAID,
  CANCELLED;

  public String dbValue() {
    return name().toLowerCase();
  }

  public static InvoiceStatus fromDb(String value) {
    return valueOf(value.toUpperCase());
  }

  public boolean acceptsPayment() {
    return this == PENDING || this == PARTIAL;
  }
}
