package io.hmis.backend.deadletter;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.EventBusProperties;
import io.hmis.backend.event.EventCodec;
import io.hmis.backend.event.EventLogEntry;
import io.hmis.backend.event.EventLogStore;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * The reserved stream of failed handler invocations. Each entry keeps the serialized event, the
 * failing handler's name and the error message. Nothing here retries or drains entries.
 */
@Component
public class DeadLetterQueue {

  static final String FIELD_EVENT_DATA = "event_data";
  static final String FIELD_HANDLER = "handler";
  static final String FIELD_ERROR = "error";
  static final String FIELD_FAILED_AT = "failed_at";
  static final String FIELD_EVENT_TYPE = "event_type";
  static final String FIELD_EVENT_ID = "event_id";
  static final String FIELD_AGGREGATE_TYPE = "aggregate_type";
  static final String FIELD_AGGREGATE_ID = "aggregate_id";

  private final EventLogStore store;
  private final EventCodec codec;
  private final EventBusProperties properties;
  private final Clock clock;

  public DeadLetterQueue(
      EventLogStore store, EventCodec codec, EventBusProperties properties, Clock clock) {
    this.store = store;
    this.codec = codec;
    this.properties = properties;
    this.clock = clock;
  }

  public String record(DomainEvent event, String handlerName, Throwable error) {
    var fields = new LinkedHashMap<String, String>();
    fields.put(FIELD_EVENT_DATA, codec.encode(event));
    fields.put(FIELD_HANDLER, handlerName);
    fields.put(FIELD_ERROR, String.valueOf(error.getMessage()));
    fields.put(FIELD_FAILED_AT, clock.instant().toString());
    fields.put(FIELD_EVENT_TYPE, event.eventType());
    fields.put(FIELD_EVENT_ID, event.eventId());
    fields.put(FIELD_AGGREGATE_TYPE, event.aggregateType());
    fields.put(FIELD_AGGREGATE_ID, event.aggregateId());
    return store.append(properties.deadLetterStream(), fields, properties.deadLetterMaxLength());
  }

  public boolean exists() {
    return store.exists(properties.deadLetterStream());
  }

  public long depth() {
    return store.length(properties.deadLetterStream());
  }

  /** Newest failures first, rendered as {@code "event_type (handler)"}. */
  public List<String> latestSummaries(int count) {
    return store.latest(properties.deadLetterStream(), count).stream()
        .map(DeadLetterQueue::summarize)
        .toList();
  }

  static String summarize(EventLogEntry entry) {
    String eventType = orUnknown(entry.field(FIELD_EVENT_TYPE));
    return eventType + " (" + orUnknown(entry.field(FIELD_HANDLER)) + ")";
  }

  private static String orUnknown(String value) {
    return value != null ? value : "unknown";
  }

  public String streamName() {
    return properties.deadLetterStream();
  }
}
