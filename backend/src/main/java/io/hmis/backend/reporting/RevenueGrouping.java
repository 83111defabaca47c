package io.hmis.backend.reporting;

import io.hmis.backend.exception.InvalidStateException;

/** Time-series granularity. {@link #truncUnit()} is a Postgres {@code date_trunc} field. */
public enum RevenueGrouping {
  DAY,
  WEEK,
  MONTH;

  public String truncUnit() {
    return name().toLowerCase();
  }

  public static RevenueGrouping fromParam(String value) {
    if (value == null || value.isBlank()) {
      return DAY;
    }
    try {
      return valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid grouping", "group_by must be one of day, week, month but was " + value);
    }
  }
}
