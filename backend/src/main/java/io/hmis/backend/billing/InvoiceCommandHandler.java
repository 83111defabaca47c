package io.hmis.backend.billing;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.exception.InvalidStateException;
import io.hmis.backend.exception.ResourceNotFoundException;
import io.hmis.backend.multitenancy.ReadPath;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Invoice and payment writes. Each command commits on the primary store first and only then
 * publishes its event; a failed command publishes nothing.
 *
 * <p>Commit and publish are separate steps. A crash between them keeps the write and loses the
 * event.
 */
@Service
public class InvoiceCommandHandler {

  private static final Logger log = LoggerFactory.getLogger(InvoiceCommandHandler.class);

  private final TenantSessionProvider sessions;
  private final InvoiceRepository invoiceRepository;
  private final InvoiceNumberGenerator numberGenerator;
  private final DomainEventBus eventBus;
  private final Clock clock;

  public InvoiceCommandHandler(
      TenantSessionProvider sessions,
      InvoiceRepository invoiceRepository,
      InvoiceNumberGenerator numberGenerator,
      DomainEventBus eventBus,
      Clock clock) {
    this.sessions = sessions;
    this.invoiceRepository = invoiceRepository;
    this.numberGenerator = numberGenerator;
    this.eventBus = eventBus;
    this.clock = clock;
  }

  public Invoice createInvoice(TenantContext context, CreateInvoiceCommand command, UUID userId) {
    String tenantId = context.requireTenantId();
    var invoiceId = UUID.randomUUID();

    var items = new ArrayList<ChargeItem>();
    BigDecimal subtotal = BigDecimal.ZERO;
    for (var line : command.chargeItems()) {
      BigDecimal lineTotal = line.total().setScale(2, RoundingMode.HALF_UP);
      items.add(
          new ChargeItem(
              UUID.randomUUID(),
              invoiceId,
              line.serviceCode(),
              line.description(),
              line.quantity(),
              line.unitPrice(),
              lineTotal));
      subtotal = subtotal.add(lineTotal);
    }
    BigDecimal taxAmount = subtotal.multiply(command.taxRate()).setScale(2, RoundingMode.HALF_UP);
    BigDecimal grandTotal = subtotal.add(taxAmount);

    var invoice =
        new Invoice(
            invoiceId,
            command.patientId(),
            command.encounterId(),
            numberGenerator.next(),
            subtotal,
            taxAmount,
            grandTotal,
            BigDecimal.ZERO.setScale(2),
            grandTotal,
            InvoiceStatus.PENDING,
            clock.instant());

    sessions.inTransaction(
        context,
        session -> {
          invoiceRepository.insertInvoice(session, invoice, userId);
          items.forEach(
              item ->
                  invoiceRepository.insertChargeItem(
                      session, item, command.encounterId(), userId));
          return invoice;
        });
    log.info(
        "Invoice created: tenantId={}, invoiceId={}, invoiceNumber={}, grandTotal={}",
        tenantId,
        invoice.id(),
        invoice.invoiceNumber(),
        grandTotal);

    eventBus.publish(
        DomainEvent.builder(EventTypes.INVOICE_GENERATED, "Invoice", invoice.id())
            .timestamp(clock.instant())
            .tenantId(tenantId)
            .userId(userId)
            .data("invoice_id", invoice.id().toString())
            .data("patient_id", invoice.patientId().toString())
            .data("invoice_number", invoice.invoiceNumber())
            .data("grand_total", grandTotal)
            .data("status", invoice.status().dbValue())
            .build());
    return invoice;
  }

  /**
   * Applies a payment to an invoice under a row lock. Rejects payments to settled or cancelled
   * invoices and payments larger than the outstanding balance.
   */
  public Payment recordPayment(
      TenantContext context, UUID invoiceId, RecordPaymentCommand command, UUID userId) {
    String tenantId = context.requireTenantId();

    var result =
        sessions.inTransaction(
            context,
            session -> {
              var invoice =
                  invoiceRepository
                      .findByIdForUpdate(session, invoiceId)
                      .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
              if (!invoice.status().acceptsPayment()) {
                throw new InvalidStateException(
                    "Invoice not payable",
                    "Invoice " + invoice.invoiceNumber() + " is " + invoice.status().dbValue());
              }
              if (command.amount().compareTo(invoice.balanceDue()) > 0) {
                throw new InvalidStateException(
                    "Overpayment",
                    "Payment of "
                        + command.amount()
                        + " exceeds balance due "
                        + invoice.balanceDue());
              }

              BigDecimal amountPaid = invoice.amountPaid().add(command.amount());
              BigDecimal balanceDue = invoice.balanceDue().subtract(command.amount());
              InvoiceStatus status =
                  balanceDue.signum() == 0 ? InvoiceStatus.PAID : InvoiceStatus.PARTIAL;

              var payment =
                  new Payment(
                      UUID.randomUUID(),
                      invoiceId,
                      command.amount(),
                      command.paymentMethod(),
                      command.referenceNumber(),
                      clock.instant());
              invoiceRepository.insertPayment(session, payment, userId);
              invoiceRepository.updatePaymentTotals(
                  session, invoiceId, amountPaid, balanceDue, status);
              return new PaymentOutcome(payment, status);
            });
    var payment = result.payment();
    log.info(
        "Payment recorded: tenantId={}, invoiceId={}, paymentId={}, amount={}, invoiceStatus={}",
        tenantId,
        invoiceId,
        payment.id(),
        payment.amount(),
        result.invoiceStatus().dbValue());

    eventBus.publish(
        DomainEvent.builder(EventTypes.PAYMENT_RECEIVED, "Payment", payment.id())
            .timestamp(clock.instant())
            .tenantId(tenantId)
            .userId(userId)
            .data("payment_id", payment.id().toString())
            .data("invoice_id", invoiceId.toString())
            .data("amount", payment.amount())
            .data("payment_method", payment.paymentMethod())
            .build());
    return payment;
  }

  public InvoiceDetails getInvoice(TenantContext context, UUID invoiceId) {
    return sessions.readOnly(
        context,
        ReadPath.PRIMARY,
        session -> {
          var invoice =
              invoiceRepository
                  .findById(session, invoiceId)
                  .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
          return new InvoiceDetails(invoice, invoiceRepository.findChargeItems(session, invoiceId));
        });
  }

  private record PaymentOutcome(Payment payment, InvoiceStatus invoiceStatus) {}
}
