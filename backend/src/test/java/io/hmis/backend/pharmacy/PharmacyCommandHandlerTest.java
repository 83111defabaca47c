package io.hmis.backend.pharmacy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSession;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PharmacyCommandHandlerTest {

  private static final TenantContext CLINIC_A = TenantContext.of("clinic-a", "tenant_clinic_a");
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  @Mock private TenantSessionProvider sessions;
  @Mock private TenantSession session;
  @Mock private PrescriptionRepository prescriptionRepository;
  @Mock private DomainEventBus eventBus;

  private PharmacyCommandHandler handler;

  @BeforeEach
  void setUp() {
    handler = new PharmacyCommandHandler(sessions, prescriptionRepository, eventBus, CLOCK);
  }

  @Test
  void partialDispenseKeepsPrescriptionActive() {
    var prescription = prescription(30, 10, Prescription.STATUS_ACTIVE);
    stubPrescription(prescription);
    var pharmacist = UUID.randomUUID();

    var record =
        handler.dispenseMedication(
            CLINIC_A, prescription.id(), new DispenseMedicationCommand(5, pharmacist, null), null);

    assertThat(record.quantityDispensed()).isEqualTo(5);
    assertThat(record.dispensedBy()).isEqualTo(pharmacist);
    assertThat(record.dispensedAt()).isEqualTo(CLOCK.instant());
    verify(prescriptionRepository).insertDispensation(session, record, null);
    verify(prescriptionRepository)
        .updateDispensed(session, prescription.id(), 15, Prescription.STATUS_ACTIVE);

    var event = publishedEvent();
    assertThat(event.eventType()).isEqualTo(EventTypes.MEDICATION_DISPENSED);
    assertThat(event.aggregateType()).isEqualTo("DispensationRecord");
    assertThat(event.aggregateId()).isEqualTo(record.id().toString());
    assertThat(event.text("prescription_id")).contains(prescription.id().toString());
    assertThat(event.decimal("quantity_dispensed")).isEqualByComparingTo("5");
    assertThat(event.timestamp()).isEqualTo(CLOCK.instant());
  }

  @Test
  void dispensingTheRemainderCompletesPrescription() {
    var prescription = prescription(30, 10, Prescription.STATUS_ACTIVE);
    stubPrescription(prescription);

    handler.dispenseMedication(
        CLINIC_A,
        prescription.id(),
        new DispenseMedicationCommand(20, UUID.randomUUID(), "final fill"),
        null);

    verify(prescriptionRepository)
        .updateDispensed(session, prescription.id(), 30, Prescription.STATUS_COMPLETED);
  }

  @Test
  void dispensingMoreThanRemainsIsRejected() {
    var prescription = prescription(30, 25, Prescription.STATUS_ACTIVE);
    stubPrescription(prescription);
    var command = new DispenseMedicationCommand(6, UUID.randomUUID(), null);

    assertThatThrownBy(
            () -> handler.dispenseMedication(CLINIC_A, prescription.id(), command, null))
        .isInstanceOf(InvalidStateException.class);

    verify(prescriptionRepository, never()).updateDispensed(any(), any(), anyInt(), anyString());
    verify(eventBus, never()).publish(any());
  }

  @Test
  void completedPrescriptionIsRejected() {
    var prescription = prescription(30, 30, Prescription.STATUS_COMPLETED);
    stubPrescription(prescription);
    var command = new DispenseMedicationCommand(1, UUID.randomUUID(), null);

    assertThatThrownBy(
            () -> handler.dispenseMedication(CLINIC_A, prescription.id(), command, null))
        .isInstanceOf(InvalidStateException.class);

    verify(eventBus, never()).publish(any());
  }

  @Test
  void unknownPrescriptionIsNotFound() {
    runTransactionsInline();
    var prescriptionId = UUID.randomUUID();
    when(prescriptionRepository.findByIdForUpdate(session, prescriptionId))
        .thenReturn(Optional.empty());
    var command = new DispenseMedicationCommand(1, UUID.randomUUID(), null);

    assertThatThrownBy(() -> handler.dispenseMedication(CLINIC_A, prescriptionId, command, null))
        .isInstanceOf(ResourceNotFoundException.class);

    verify(eventBus, never()).publish(any());
  }

  private void stubPrescription(Prescription prescription) {
    runTransactionsInline();
    when(prescriptionRepository.findByIdForUpdate(session, prescription.id()))
        .thenReturn(Optional.of(prescription));
  }

  @SuppressWarnings("unchecked")
  private void runTransactionsInline() {
    when(sessions.inTransaction(eq(CLINIC_A), any()))
        .thenAnswer(
            invocation ->
                ((Function<TenantSession, Object>) invocation.getArgument(1)).apply(session));
  }

  private DomainEvent publishedEvent() {
    var captor = ArgumentCaptor.forClass(DomainEvent.class);
    verify(eventBus).publish(captor.capture());
    return captor.getValue();
  }

  private static Prescription prescription(int prescribed, int dispensed, String status) {
    return new Prescription(
        UUID.randomUUID(), UUID.randomUUID(), "Metformin 500mg", prescribed, dispensed, status);
  }
}
