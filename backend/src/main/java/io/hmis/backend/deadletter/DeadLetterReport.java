package io.hmis.backend.deadletter;

import java.util.List;

/** Outcome of one dead-letter depth check. */
public record DeadLetterReport(DeadLetterLevel level, long depth, List<String> recentFailures) {

  public DeadLetterReport {
    recentFailures = List.copyOf(recentFailures);
  }

  static DeadLetterReport of(DeadLetterLevel level, long depth) {
    return new DeadLetterReport(level, depth, List.of());
  }
}
