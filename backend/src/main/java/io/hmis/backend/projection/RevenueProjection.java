package io.hmis.backend.projection;

import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.EventHandlerRegistry;
import io.hmis.backend.event.EventTypes;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-tenant, per-day invoiced and collected totals. The day is the UTC date of the event
 * timestamp. Each day bucket expires on its own, long after the day is over.
 */
@Component
public class RevenueProjection implements ProjectionMaintainer {

  private static final Logger log = LoggerFactory.getLogger(RevenueProjection.class);

  static final String KEY_PREFIX = "projection:revenue:";
  static final Duration TTL = Duration.ofDays(90);

  static final String TOTAL_INVOICED = "total_invoiced";
  static final String INVOICE_COUNT = "invoice_count";
  static final String TOTAL_COLLECTED = "total_collected";
  static final String PAYMENT_COUNT = "payment_count";

  private final ProjectionStore store;

  public RevenueProjection(ProjectionStore store) {
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
    store.hashIncrement(
        key(event.tenantId(), dayOf(event)),
        Map.of(TOTAL_INVOICED, event.decimal("grand_total"), INVOICE_COUNT, BigDecimal.ONE),
        TTL);
  }

  public void onPaymentReceived(DomainEvent event) {
    if (event.tenantId() == null) {
      log.warn("Skipping payment event without tenant: eventId={}", event.eventId());
      return;
    }
    store.hashIncrement(
        key(event.tenantId(), dayOf(event)),
        Map.of(TOTAL_COLLECTED, event.decimal("amount"), PAYMENT_COUNT, BigDecimal.ONE),
        TTL);
  }

  /** Empty on a cache miss. */
  public Optional<DailyRevenue> dailyRevenue(String tenantId, LocalDate date) {
    return store.hashGetAll(key(tenantId, date)).map(fields -> DailyRevenue.from(date, fields));
  }

  /** Cached days within {@code [from, to]}, in date order; days without data are omitted. */
  public List<DailyRevenue> dailyRevenue(String tenantId, LocalDate from, LocalDate to) {
    var days = new ArrayList<DailyRevenue>();
    for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
      dailyRevenue(tenantId, day).ifPresent(days::add);
    }
    return days;
  }

  static LocalDate dayOf(DomainEvent event) {
    return LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC);
  }

  static String key(String tenantId, LocalDate date) {
    return KEY_PREFIX + tenantId + ":" + date;
  }
}
