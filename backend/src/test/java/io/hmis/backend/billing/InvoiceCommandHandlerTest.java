package io.hmis.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSession;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
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
class InvoiceCommandHandlerTest {

  private static final TenantContext CLINIC_A = TenantContext.of("clinic-a", "tenant_clinic_a");
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
  private static final UUID USER_ID = UUID.randomUUID();

  @Mock private TenantSessionProvider sessions;
  @Mock private TenantSession session;
  @Mock private InvoiceRepository invoiceRepository;
  @Mock private DomainEventBus eventBus;

  private InvoiceCommandHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new InvoiceCommandHandler(
            sessions, invoiceRepository, new InvoiceNumberGenerator(CLOCK), eventBus, CLOCK);
  }

  @Test
  void createInvoice_computesTotalsAndPublishesOneEvent() {
    runTransactionsInline();
    var patientId = UUID.randomUUID();
    var command =
        new CreateInvoiceCommand(
            patientId,
            null,
            List.of(
                new CreateInvoiceCommand.ChargeLine(
                    "CONS01", "Consultation", 2, new BigDecimal("250.00")),
                new CreateInvoiceCommand.ChargeLine(
                    "LAB02", "Blood panel", 1, new BigDecimal("100.00"))),
            new BigDecimal("0.10"));

    var invoice = handler.createInvoice(CLINIC_A, command, USER_ID);

    assertThat(invoice.subtotal()).isEqualByComparingTo("600.00");
    assertThat(invoice.taxAmount()).isEqualByComparingTo("60.00");
    assertThat(invoice.grandTotal()).isEqualByComparingTo("660.00");
    assertThat(invoice.balanceDue()).isEqualByComparingTo("660.00");
    assertThat(invoice.status()).isEqualTo(InvoiceStatus.PENDING);
    assertThat(invoice.invoiceNumber()).matches("INV-20260301-[0-9A-F]{6}");
    verify(invoiceRepository).insertInvoice(session, invoice, USER_ID);
    verify(invoiceRepository, times(2)).insertChargeItem(eq(session), any(), isNull(), eq(USER_ID));

    var event = publishedEvent();
    assertThat(event.eventType()).isEqualTo(EventTypes.INVOICE_GENERATED);
    assertThat(event.aggregateType()).isEqualTo("Invoice");
    assertThat(event.aggregateId()).isEqualTo(invoice.id().toString());
    assertThat(event.tenantId()).isEqualTo("clinic-a");
    assertThat(event.userId()).isEqualTo(USER_ID.toString());
    assertThat(event.timestamp()).isEqualTo(CLOCK.instant());
    assertThat(event.decimal("grand_total")).isEqualByComparingTo("660.00");
    assertThat(event.text("status")).contains("pending");
    assertThat(event.text("patient_id")).contains(patientId.toString());
    assertThat(event.text("invoice_number")).contains(invoice.invoiceNumber());
  }

  @Test
  void createInvoice_publishesNothingWhenTheWriteFails() {
    when(sessions.inTransaction(eq(CLINIC_A), any()))
        .thenThrow(new IllegalStateException("primary unavailable"));
    var command =
        new CreateInvoiceCommand(
            UUID.randomUUID(),
            null,
            List.of(new CreateInvoiceCommand.ChargeLine(null, "Visit", 1, BigDecimal.TEN)),
            BigDecimal.ZERO);

    assertThatThrownBy(() -> handler.createInvoice(CLINIC_A, command, USER_ID))
        .hasMessage("primary unavailable");

    verifyNoInteractions(eventBus);
  }

  @Test
  void createInvoice_requiresTenant() {
    var command =
        new CreateInvoiceCommand(
            UUID.randomUUID(),
            null,
            List.of(new CreateInvoiceCommand.ChargeLine(null, "Visit", 1, BigDecimal.TEN)),
            BigDecimal.ZERO);

    assertThatThrownBy(() -> handler.createInvoice(TenantContext.none(), command, USER_ID))
        .isInstanceOf(IllegalStateException.class);

    verifyNoInteractions(sessions, eventBus);
  }

  @Test
  void recordPayment_partialPaymentLeavesInvoicePartial() {
    runTransactionsInline();
    var invoice = pendingInvoice("1000.00");
    when(invoiceRepository.findByIdForUpdate(session, invoice.id()))
        .thenReturn(Optional.of(invoice));

    var payment =
        handler.recordPayment(
            CLINIC_A,
            invoice.id(),
            new RecordPaymentCommand(new BigDecimal("400.00"), "cash", null),
            USER_ID);

    assertThat(payment.amount()).isEqualByComparingTo("400.00");
    assertThat(payment.receivedAt()).isEqualTo(CLOCK.instant());
    verify(invoiceRepository).insertPayment(session, payment, USER_ID);
    verify(invoiceRepository)
        .updatePaymentTotals(
            session,
            invoice.id(),
            new BigDecimal("400.00"),
            new BigDecimal("600.00"),
            InvoiceStatus.PARTIAL);

    var event = publishedEvent();
    assertThat(event.eventType()).isEqualTo(EventTypes.PAYMENT_RECEIVED);
    assertThat(event.aggregateType()).isEqualTo("Payment");
    assertThat(event.aggregateId()).isEqualTo(payment.id().toString());
    assertThat(event.decimal("amount")).isEqualByComparingTo("400.00");
    assertThat(event.text("invoice_id")).contains(invoice.id().toString());
    assertThat(event.text("payment_method")).contains("cash");
    assertThat(event.timestamp()).isEqualTo(CLOCK.instant());
  }

  @Test
  void recordPayment_fullPaymentMarksInvoicePaid() {
    runTransactionsInline();
    var invoice = pendingInvoice("1000.00");
    when(invoiceRepository.findByIdForUpdate(session, invoice.id()))
        .thenReturn(Optional.of(invoice));

    handler.recordPayment(
        CLINIC_A,
        invoice.id(),
        new RecordPaymentCommand(new BigDecimal("1000.00"), "card", "TX-1"),
        USER_ID);

    verify(invoiceRepository)
        .updatePaymentTotals(
            session,
            invoice.id(),
            new BigDecimal("1000.00"),
            new BigDecimal("0.00"),
            InvoiceStatus.PAID);
  }

  @Test
  void recordPayment_rejectsOverpaymentAndPublishesNothing() {
    runTransactionsInline();
    var invoice = pendingInvoice("1000.00");
    when(invoiceRepository.findByIdForUpdate(session, invoice.id()))
        .thenReturn(Optional.of(invoice));
    var command = new RecordPaymentCommand(new BigDecimal("1000.01"), "cash", null);

    assertThatThrownBy(() -> handler.recordPayment(CLINIC_A, invoice.id(), command, USER_ID))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Overpayment"));

    verify(invoiceRepository, never()).insertPayment(any(), any(), any());
    verify(eventBus, never()).publish(any());
  }

  @Test
  void recordPayment_rejectsSettledInvoice() {
    runTransactionsInline();
    var paid =
        new Invoice(
            UUID.randomUUID(),
            UUID.randomUUID(),
            null,
            "INV-20260301-ABCDEF",
            new BigDecimal("100.00"),
            BigDecimal.ZERO,
            new BigDecimal("100.00"),
            new BigDecimal("100.00"),
            new BigDecimal("0.00"),
            InvoiceStatus.PAID,
            CLOCK.instant());
    when(invoiceRepository.findByIdForUpdate(session, paid.id())).thenReturn(Optional.of(paid));
    var command = new RecordPaymentCommand(BigDecimal.ONE, "cash", null);

    assertThatThrownBy(() -> handler.recordPayment(CLINIC_A, paid.id(), command, USER_ID))
        .isInstanceOf(InvalidStateException.class);

    verify(eventBus, never()).publish(any());
  }

  @Test
  void recordPayment_unknownInvoiceIsNotFound() {
    runTransactionsInline();
    var invoiceId = UUID.randomUUID();
    when(invoiceRepository.findByIdForUpdate(session, invoiceId)).thenReturn(Optional.empty());
    var command = new RecordPaymentCommand(BigDecimal.ONE, "cash", null);

    assertThatThrownBy(() -> handler.recordPayment(CLINIC_A, invoiceId, command, USER_ID))
        .isInstanceOf(ResourceNotFoundException.class);

    verify(eventBus, never()).publish(any());
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

  private static Invoice pendingInvoice(String grandTotal) {
    var total = new BigDecimal(grandTotal);
    return new Invoice(
        UUID.randomUUID(),
        UUID.randomUUID(),
        null,
        "INV-20260301-0A1B2C",
        total,
        new BigDecimal("0.00"),
        total,
        new BigDecimal("0.00"),
        total,
        InvoiceStatus.PENDING,
        CLOCK.instant());
  }
}
