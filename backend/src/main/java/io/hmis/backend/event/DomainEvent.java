package io.hmis.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of a change to one aggregate, published by a command handler after its
 * transaction commits. The payload is schema-less so producers can add fields without a wire-format
 * migration; consumers read it through {@link #decimal(String)} and {@link #text(String)}.
 *
 * <p>{@code timestamp} is the publisher's creation time, not the storage time. {@code tenantId} is
 * present for every tenant-scoped event; {@code userId} identifies the actor when known.
 */
public record DomainEvent(
    String eventType,
    String aggregateType,
    String aggregateId,
    Map<String, Object> data,
    String eventId,
    Instant timestamp,
    String tenantId,
    String userId) {

  public DomainEvent {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(timestamp, "timestamp");
    data =
        data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(data));
  }

  public static Builder builder(String eventType, String aggregateType, Object aggregateId) {
    return new Builder(eventType, aggregateType, String.valueOf(aggregateId));
  }

  /** Numeric payload value; absent or null values read as zero. */
  public BigDecimal decimal(String key) {
    Object value = data.get(key);
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString());
    }
    return new BigDecimal(value.toString().trim());
  }

  public Optional<String> text(String key) {
    Object value = data.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString();
    return text.isBlank() ? Optional.empty() : Optional.of(text);
  }

  public static final class Builder {

    private final String eventType;
    private final String aggregateType;
    private final String aggregateId;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private String eventId;
    private Instant timestamp;
    private String tenantId;
    private String userId;

    private Builder(String eventType, String aggregateType, String aggregateId) {
      this.eventType = eventType;
      this.aggregateType = aggregateType;
      this.aggregateId = aggregateId;
    }

    public Builder data(String key, Object value) {
      data.put(key, value);
      return this;
    }

    public Builder data(Map<String, ?> values) {
      data.putAll(values);
      return this;
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder userId(Object userId) {
      this.userId = userId != null ? userId.toString() : null;
      return this;
    }

    public DomainEvent build() {
      return new DomainEvent(
          eventType,
          aggregateType,
          aggregateId,
          data,
          eventId != null ? eventId : UUID.randomUUID().toString(),
          timestamp != null ? timestamp : Instant.now(),
          tenantId,
          userId);
    }
  }
}
