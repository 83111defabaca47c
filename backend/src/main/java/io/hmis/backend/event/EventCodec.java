package io.hmis.backend.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** JSON wire form of a {@link DomainEvent}, with snake_case keys. */
@Component
public class EventCodec {

  private final ObjectMapper objectMapper;

  public EventCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(DomainEvent event) {
    var body = new LinkedHashMap<String, Object>();
    body.put("event_id", event.eventId());
    body.put("event_type", event.eventType());
    body.put("aggregate_type", event.aggregateType());
    body.put("aggregate_id", event.aggregateId());
    body.put("data", event.data());
    body.put("timestamp", event.timestamp().toString());
    body.put("tenant_id", event.tenantId());
    body.put("user_id", event.userId());
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize event " + event.eventId(), e);
    }
  }

  /** Single-field entry stored in the durable log. */
  public Map<String, String> toLogFields(DomainEvent event) {
    return Map.of("data", encode(event));
  }
}
