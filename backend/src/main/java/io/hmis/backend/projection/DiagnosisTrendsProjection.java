package io.hmis.backend.projection;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.EventHandlerRegistry;
import io.hmis.backend.event.EventTypes;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Per-tenant ranking of ICD-10 codes by how often they were diagnosed. */
@Component
public class DiagnosisTrendsProjection implements ProjectionMaintainer {

  private static final Logger log = LoggerFactory.getLogger(DiagnosisTrendsProjection.class);

  static final String KEY_PREFIX = "projection:diagnoses:";
  static final Duration TTL = Duration.ofHours(2);

  private final ProjectionStore store;

  public DiagnosisTrendsProjection(ProjectionStore store) {
    this.store = store;
  }

  @Override
  public void register(EventHandlerRegistry registry) {
    registry.subscribe(
        EventTypes.DIAGNOSIS_ADDED, handlerName("onDiagnosisAdded"), this::onDiagnosisAdded);
  }

  public void onDiagnosisAdded(DomainEvent event) {
    if (event.tenantId() == null) {
      log.warn("Skipping diagnosis event without tenant: eventId={}", event.eventId());
      return;
    }
    var code = event.text("icd10_code");
    if (code.isEmpty()) {
      log.warn("Skipping diagnosis event without icd10_code: eventId={}", event.eventId());
      return;
    }
    store.rankIncrement(key(event.tenantId()), code.get(), BigDecimal.ONE, TTL);
  }

  /** Top {@code limit} codes, most frequent first. Empty on a cache miss. */
  public Optional<List<DiagnosisCount>> topDiagnoses(String tenantId, int limit) {
    var ranked = store.rankTop(key(tenantId), limit);
    if (ranked.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        ranked.stream()
            .map(member -> new DiagnosisCount(member.member(), member.score().longValue()))
            .toList());
  }

  static String key(String tenantId) {
    return KEY_PREFIX + tenantId;
  }
}
