package io.hmis.backend.deadletter;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Dead-letter monitor thresholds. Depth above {@code warningThreshold} warns; depth above {@code
 * criticalThreshold} raises a critical alert listing {@code sampleSize} recent failures.
 */
@ConfigurationProperties("hmis.dead-letter")
public record DeadLetterProperties(
    @DefaultValue("10") long warningThreshold,
    @DefaultValue("50") long criticalThreshold,
    @DefaultValue("5") int sampleSize,
    @DefaultValue("PT5M") Duration monitorInterval) {

  public static DeadLetterProperties defaults() {
    return new DeadLetterProperties(10, 50, 5, Duration.ofMinutes(5));
  }
}
