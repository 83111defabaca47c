package io.hmis.backend.reporting;

import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.multitenancy.ReadPath;
import java.time.LocalDate;
import java.util.Objects;

/** Inclusive date range. */
public record RevenueAnalysisQuery(
    LocalDate startDate, LocalDate endDate, RevenueGrouping groupBy, ReadPath readPath) {

  public RevenueAnalysisQuery {
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    if (endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid date range", "end_date " + endDate + " is before start_date " + startDate);
    }
    groupBy = groupBy != null ? groupBy : RevenueGrouping.DAY;
    readPath = readPath != null ? readPath : ReadPath.REPLICA;
  }
}
