package io.hmis.backend.event;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Event bus settings.
 *
 * @param streamPrefix durable log stream name is this prefix plus the aggregate type
 * @param streamMaxLength entries retained per aggregate-type stream
 * @param deadLetterStream stream receiving failed handler invocations
 * @param deadLetterMaxLength entries retained in the dead-letter stream
 * @param deadLetterOnFailure whether handler failures are written to the dead-letter stream
 */
@ConfigurationProperties("hmis.events")
public record EventBusProperties(
    @DefaultValue("events:") String streamPrefix,
    @DefaultValue("10000") int streamMaxLength,
    @DefaultValue("events:dlq") String deadLetterStream,
    @DefaultValue("5000") int deadLetterMaxLength,
    @DefaultValue("true") boolean deadLetterOnFailure) {

  public static EventBusProperties defaults() {
    return new EventBusProperties("events:", 10_000, "events:dlq", 5_000, true);
  }

  public String streamFor(String aggregateType) {
    return streamPrefix + aggregateType;
  }
}
