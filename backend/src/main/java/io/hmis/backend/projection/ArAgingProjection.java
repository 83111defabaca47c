package io.hmis.backend.projection;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.EventHandlerRegistry;
import io.hmis.backend.event.EventTypes;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-tenant accounts-receivable counters, fed by invoice and payment events. Updates are not
 * idempotent: replaying an event counts it again.
 */
@Component
public class ArAgingProjection implements ProjectionMaintainer {

  private static final Logger log = LoggerFactory.getLogger(ArAgingProjection.class);

  static final String KEY_PREFIX = "projection:ar_aging:";
  static final Duration TTL = Duration.ofHours(1);

  static final String TOTAL_INVOICES = "total_invoices";
  static final String TOTAL_AR = "total_ar";
  static final String TOTAL_COLLECTED = "total_collected";
  static final String STATUS_PREFIX = "status:";

  private final ProjectionStore store;

  public ArAgingProjection(ProjectionStore store) {
    this.store = store;
  }

  @Override
  public void register(EventHandlerRegistry registry) {
    registry.subscribe(
        EventTypes.INVOICE_GENERATED, handlerName("onInvoiceGenerated"), this::onInvoiceGenerated);
    registry.subscribe(
        EventTypes.PAYMENT_RECEIVED, handlerName("onPaymentReceived"), this::onPaymentReceived);
  }

  public void onInvoiceGenerated(DomainEvent event) {
    if (event.tenantId() == null) {
      log.warn("Skipping invoice event without tenant: eventId={}", event.eventId());
      return;
    }
    BigDecimal grandTotal = event.decimal("grand_total");
    String status = event.text("status").orElse("pending");
    store.hashIncrement(
        key(event.tenantId()),
        Map.of(
            TOTAL_INVOICES, BigDecimal.ONE,
            TOTAL_AR, grandTotal,
            STATUS_PREFIX + status, BigDecimal.ONE),
        TTL);
    log.debug(
        "AR aging updated: tenantId={}, invoiceId={}, grandTotal={}",
        event.tenantId(),
        event.aggregateId(),
        grandTotal);
  }

  public void onPaymentReceived(DomainEvent event) {
    if (event.tenantId() == null) {
      log.warn("Skipping payment event without tenant: eventId={}", event.eventId());
      return;
    }
    BigDecimal amount = event.decimal("amount");
    store.hashIncrement(
        key(event.tenantId()), Map.of(TOTAL_AR, amount.negate(), TOTAL_COLLECTED, amount), TTL);
    log.debug(
        "AR aging updated: tenantId={}, paymentId={}, amount={}",
        event.tenantId(),
        event.aggregateId(),
        amount);
  }

  /** Empty on a cache miss; callers then compute from the primary store. */
  public Optional<ArAgingSummary> summary(String tenantId) {
    return store.hashGetAll(key(tenantId)).map(ArAgingSummary::from);
  }

  static String key(String tenantId) {
    return KEY_PREFIX + tenantId;
  }
}
