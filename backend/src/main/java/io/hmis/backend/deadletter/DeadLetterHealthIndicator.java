package io.hmis.backend.deadletter;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Exposes the dead-letter depth under {@code /actuator/health}. */
@Component("deadLetter")
public class DeadLetterHealthIndicator implements HealthIndicator {

  private final DeadLetterMonitor monitor;

  public DeadLetterHealthIndicator(DeadLetterMonitor monitor) {
    this.monitor = monitor;
  }

  @Override
  public Health health() {
    var report = monitor.inspect();
    var builder =
        report.level() == DeadLetterLevel.UNAVAILABLE ? Health.down() : Health.up();
    builder.withDetail("level", report.level().name()).withDetail("depth", report.depth());
    if (!report.recentFailures().isEmpty()) {
      builder.withDetail("recentFailures", report.recentFailures());
    }
    return builder.build();
  }
}
