package io.hmis.backend.deadletter;

public enum DeadLetterLevel {
  /** Nothing has ever been dead-lettered. */
  ABSENT,
  HEALTHY,
  WARNING,
  CRITICAL,
  /** The depth could not be read. */
  UNAVAILABLE
}
