package io.hmis.backend.clinical;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Encounter and diagnosis writes; each publishes its event after the commit. */
@Service
public class EncounterCommandHandler {

  private static final Logger log = LoggerFactory.getLogger(EncounterCommandHandler.class);

  static final String STATUS_IN_PROGRESS = "in_progress";

  private final TenantSessionProvider sessions;
  private final EncounterRepository encounterRepository;
  private final DomainEventBus eventBus;
  private final Clock clock;

  public EncounterCommandHandler(
      TenantSessionProvider sessions,
      EncounterRepository encounterRepository,
      DomainEventBus eventBus,
      Clock clock) {
    this.sessions = sessions;
    this.encounterRepository = encounterRepository;
    this.eventBus = eventBus;
    this.clock = clock;
  }

  public Encounter createEncounter(
      TenantContext context, CreateEncounterCommand command, UUID userId) {
    String tenantId = context.requireTenantId();
    var encounter =
        new Encounter(
            UUID.randomUUID(),
            command.patientId(),
            command.providerId(),
            command.encounterType(),
            command.reason(),
            STATUS_IN_PROGRESS,
            command.startDatetime() != null ? command.startDatetime() : clock.instant());

    sessions.inTransaction(
        context,
        session -> {
          encounterRepository.insertEncounter(session, encounter, userId);
          return encounter;
        });
    log.info(
        "Encounter created: tenantId={}, encounterId={}, patientId={}, type={}",
        tenantId,
        encounter.id(),
        encounter.patientId(),
        encounter.encounterType());

    eventBus.publish(
        DomainEvent.builder(EventTypes.ENCOUNTER_CREATED, "Encounter", encounter.id())
            .timestamp(clock.instant())
            .tenantId(tenantId)
            .userId(userId)
            .data("encounter_id", encounter.id().toString())
            .data("patient_id", encounter.patientId().toString())
            .data("provider_id", encounter.providerId().toString())
            .data("encounter_type", encounter.encounterType())
            .build());
    return encounter;
  }

  /** Adds a diagnosis to an existing encounter; the diagnosis inherits the encounter's patient. */
  public Diagnosis addDiagnosis(
      TenantContext context, UUID encounterId, AddDiagnosisCommand command, UUID userId) {
    String tenantId = context.requireTenantId();

    var diagnosis =
        sessions.inTransaction(
            context,
            session -> {
              var encounter =
                  encounterRepository
                      .findById(session, encounterId)
                      .orElseThrow(() -> new ResourceNotFoundException("Encounter", encounterId));
              var created =
                  new Diagnosis(
                      UUID.randomUUID(),
                      encounter.id(),
                      encounter.patientId(),
                      command.icd10Code(),
                      command.description(),
                      command.primary());
              encounterRepository.insertDiagnosis(session, created, userId);
              return created;
            });
    log.info(
        "Diagnosis added: tenantId={}, encounterId={}, diagnosisId={}, icd10Code={}",
        tenantId,
        encounterId,
        diagnosis.id(),
        diagnosis.icd10Code());

    eventBus.publish(
        DomainEvent.builder(EventTypes.DIAGNOSIS_ADDED, "Diagnosis", diagnosis.id())
            .timestamp(clock.instant())
            .tenantId(tenantId)
            .userId(userId)
            .data("diagnosis_id", diagnosis.id().toString())
            .data("encounter_id", encounterId.toString())
            .data("patient_id", diagnosis.patientId().toString())
            .data("icd10_code", diagnosis.icd10Code())
            .data("description", diagnosis.description())
            .data("is_primary", diagnosis.primary())
            .build());
    return diagnosis;
  }
}
