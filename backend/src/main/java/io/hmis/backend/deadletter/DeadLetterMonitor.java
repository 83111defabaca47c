package io.hmis.backend.deadletter;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic check of the dead-letter stream depth. Logs a healthy status, a warning, or a critical
 * alert carrying the most recent failure summaries. Observes only; it never retries or drains.
 */
@Component
public class DeadLetterMonitor {

  private static final Logger log = LoggerFactory.getLogger(DeadLetterMonitor.class);

  static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

  private final DeadLetterQueue deadLetterQueue;
  private final DeadLetterProperties properties;

  public DeadLetterMonitor(DeadLetterQueue deadLetterQueue, DeadLetterProperties properties) {
    this.deadLetterQueue = deadLetterQueue;
    this.properties = properties;
  }

  @Scheduled(
      initialDelayString = "${hmis.dead-letter.monitor-interval:PT5M}",
      fixedDelayString = "${hmis.dead-letter.monitor-interval:PT5M}")
  public void monitor() {
    try {
      report(inspect());
    } catch (Exception e) {
      log.error("Dead-letter monitor run failed", e);
    }
  }

  /** Reads the current depth and classifies it. Never throws. */
  public DeadLetterReport inspect() {
    try {
      if (!deadLetterQueue.exists()) {
        return DeadLetterReport.of(DeadLetterLevel.ABSENT, 0);
      }
      long depth = deadLetterQueue.depth();
      if (depth > properties.criticalThreshold()) {
        List<String> recent = deadLetterQueue.latestSummaries(properties.sampleSize());
        return new DeadLetterReport(DeadLetterLevel.CRITICAL, depth, recent);
      }
      if (depth > properties.warningThreshold()) {
        return DeadLetterReport.of(DeadLetterLevel.WARNING, depth);
      }
      return DeadLetterReport.of(DeadLetterLevel.HEALTHY, depth);
    } catch (RuntimeException e) {
      log.error("Dead-letter depth check failed: stream={}", deadLetterQueue.streamName(), e);
      return DeadLetterReport.of(DeadLetterLevel.UNAVAILABLE, 0);
    }
  }

  private void report(DeadLetterReport report) {
    switch (report.level()) {
      case ABSENT ->
          log.debug("Dead-letter stream {} does not exist yet", deadLetterQueue.streamName());
      case HEALTHY -> log.info("Dead-letter queue healthy: depth={}", report.depth());
      case WARNING ->
          log.warn(
              "Dead-letter queue depth above warning threshold: depth={}, threshold={}",
              report.depth(),
              properties.warningThreshold());
      case CRITICAL ->
          log.error(
              CRITICAL,
              "Dead-letter queue depth critical: depth={}, threshold={}, recentFailures={}",
              report.depth(),
              properties.criticalThreshold(),
              report.recentFailures());
      case UNAVAILABLE -> {
        // already logged by inspect()
      }
    }
  }
}
