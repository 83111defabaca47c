package io.hmis.backend.reporting;

import io.hmis.backend.projection.DailyRevenue;

/** One day's revenue and where it came from: the cached projection or the database. */
public record DailyRevenueReport(DailyRevenue revenue, Source source) {

  public enum Source {
    PROJECTION,
    DATABASE
  }
}
