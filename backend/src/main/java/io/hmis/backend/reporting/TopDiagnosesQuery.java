package io.hmis.backend.reporting;

import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.multitenancy.ReadPath;
import java.time.LocalDate;

/** Optional encounter date range, inclusive. */
public record TopDiagnosesQuery(
    LocalDate startDate, LocalDate endDate, int limit, ReadPath readPath) {

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  public TopDiagnosesQuery {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new InvalidStateException(
          "Invalid limit", "limit must be between 1 and " + MAX_LIMIT + " but was " + limit);
    }
    readPath = readPath != null ? readPath : ReadPath.REPLICA;
  }
}
