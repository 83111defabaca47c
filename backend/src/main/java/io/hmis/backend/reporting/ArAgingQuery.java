package io.hmis.backend.reporting;

import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.multitenancy.ReadPath;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Aging report request. Bucket bounds are day counts in strictly ascending order; {@code [30, 60]}
 * yields {@code 0-30 days}, {@code 30-60 days} and {@code 60+ days}.
 */
public record ArAgingQuery(LocalDate asOfDate, List<Integer> agingBuckets, ReadPath readPath) {

  public static final List<Integer> DEFAULT_BUCKETS = List.of(30, 60, 90, 120);

  public ArAgingQuery {
    Objects.requireNonNull(asOfDate, "asOfDate");
    agingBuckets =
        agingBuckets == null || agingBuckets.isEmpty()
            ? DEFAULT_BUCKETS
            : List.copyOf(agingBuckets);
    readPath = readPath != null ? readPath : ReadPath.REPLICA;
    int previous = 0;
    for (int bound : agingBuckets) {
      if (bound <= previous) {
        throw new InvalidStateException(
            "Invalid aging buckets",
            "Aging buckets must be positive and strictly ascending: " + agingBuckets);
      }
      previous = bound;
    }
  }

  public static ArAgingQuery asOf(LocalDate asOfDate) {
    return new ArAgingQuery(asOfDate, DEFAULT_BUCKETS, ReadPath.REPLICA);
  }
}
