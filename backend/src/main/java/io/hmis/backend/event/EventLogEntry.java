package io.hmis.backend.event;

import java.time.Instant;
import java.util.Map;

/** One entry of a named append-only stream. Ids increase monotonically within a stream. */
public record EventLogEntry(
    String id, String stream, Map<String, String> fields, Instant appendedAt) {

  public EventLogEntry {
    fields = Map.copyOf(fields);
  }

  public String field(String name) {
    return fields.get(name);
  }
}
