package io.hmis.backend.event;

import java.util.List;
import java.util.Map;

/**
 * Named, size-capped, append-only streams. Backs the per-aggregate-type event log and the
 * dead-letter stream.
 *
 * <p>Implementations:
 *
 * <ul>
 *   <li>{@link JdbcEventLogStore} - rows in {@code public.event_log} (default)
 *   <li>{@link InMemoryEventLogStore} - process-local, for single-node and test runs
 * </ul>
 *
 * <p>Selected with {@code hmis.store.type}.
 */
public interface EventLogStore {

  /**
   * Appends an entry and trims the stream to its newest {@code maxLength} entries.
   *
   * @return the id assigned to the new entry
   */
  String append(String stream, Map<String, String> fields, int maxLength);

  /** Number of entries currently retained; zero for a stream that does not exist. */
  long length(String stream);

  /** Whether anything has ever been appended to the stream. */
  boolean exists(String stream);

  /** Up to {@code count} entries, newest first. */
  List<EventLogEntry> latest(String stream, int count);
}
