package io.hmis.backend.pharmacy;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PharmacyCommandHandler {

  private static final Logger log = LoggerFactory.getLogger(PharmacyCommandHandler.class);

  private final TenantSessionProvider sessions;
  private final PrescriptionRepository prescriptionRepository;
  private final DomainEventBus eventBus;
  private final Clock clock;

  public PharmacyCommandHandler(
      TenantSessionProvider sessions,
      PrescriptionRepository prescriptionRepository,
      DomainEventBus eventBus,
      Clock clock) {
    this.sessions = sessions;
    this.prescriptionRepository = prescriptionRepository;
    this.eventBus = eventBus;
    this.clock = clock;
  }

  /**
   * Dispenses part or all of what remains on an active prescription. The prescription is completed
   * once everything prescribed has been dispensed.
   */
  public DispensationRecord dispenseMedication(
      TenantContext context, UUID prescriptionId, DispenseMedicationCommand command, UUID userId) {
    String tenantId = context.requireTenantId();

    var record =
        sessions.inTransaction(
            context,
            session -> {
              var prescription =
                  prescriptionRepository
                      .findByIdForUpdate(session, prescriptionId)
                      .orElseThrow(
                          () -> new ResourceNotFoundException("Prescription", prescriptionId));
              if (!prescription.isActive()) {
                throw new InvalidStateException(
                    "Prescription not active",
                    "Prescription " + prescriptionId + " is " + prescription.status());
              }
              if (command.quantityDispensed() > prescription.remaining()) {
                throw new InvalidStateException(
                    "Quantity exceeds prescription",
                    "Requested "
                        + command.quantityDispensed()
                        + " but only "
                        + prescription.remaining()
                        + " remain");
              }

              int dispensed = prescription.quantityDispensed() + command.quantityDispensed();
              String status =
                  dispensed == prescription.quantityPrescribed()
                      ? Prescription.STATUS_COMPLETED
                      : Prescription.STATUS_ACTIVE;
              var created =
                  new DispensationRecord(
                      UUID.randomUUID(),
                      prescriptionId,
                      command.quantityDispensed(),
                      command.dispensedBy(),
                      clock.instant(),
                      command.notes());
              prescriptionRepository.insertDispensation(session, created, userId);
              prescriptionRepository.updateDispensed(session, prescriptionId, dispensed, status);
              return created;
            });
    log.info(
        "Medication dispensed: tenantId={}, prescriptionId={}, dispensationId={}, quantity={}",
        tenantId,
        prescriptionId,
        record.id(),
        record.quantityDispensed());

    eventBus.publish(
        DomainEvent.builder(EventTypes.MEDICATION_DISPENSED, "DispensationRecord", record.id())
            .timestamp(clock.instant())
            .tenantId(tenantId)
            .userId(userId)
            .data("dispensation_id", record.id().toString())
            .data("prescription_id", prescriptionId.toString())
            .data("quantity_dispensed", record.quantityDispensed())
            .build());
    return record;
  }
}
