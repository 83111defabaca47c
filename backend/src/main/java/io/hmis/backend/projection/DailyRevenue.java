package io.hmis.backend.projection;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record DailyRevenue(
    LocalDate date,
    BigDecimal totalInvoiced,
    long invoiceCount,
    BigDecimal totalCollected,
    long paymentCount) {

  static DailyRevenue from(LocalDate date, Map<String, BigDecimal> fields) {
    return new DailyRevenue(
        date,
        fields.getOrDefault(RevenueProjection.TOTAL_INVOICED, BigDecimal.ZERO),
        fields.getOrDefault(RevenueProjection.INVOICE_COUNT, BigDecimal.ZERO).longValue(),
        fields.getOrDefault(RevenueProjection.TOTAL_COLLECTED, BigDecimal.ZERO),
        fields.getOrDefault(RevenueProjection.PAYMENT_COUNT, BigDecimal.ZERO).longValue());
  }
}
