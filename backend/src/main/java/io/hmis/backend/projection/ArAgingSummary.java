package io.hmis.backend.projection;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cached receivables totals for one tenant. {@code totalAr} is invoiced minus collected since the
 * aggregate was created; it resets when the aggregate expires.
 */
public record ArAgingSummary(
    long totalInvoices,
    BigDecimal totalAr,
    BigDecimal totalCollected,
    Map<String, Long> invoicesByStatus) {

  static ArAgingSummary from(Map<String, BigDecimal> fields) {
    var byStatus = new TreeMap<String, Long>();
    fields.forEach(
        (field, value) -> {
          if (field.startsWith(ArAgingProjection.STATUS_PREFIX)) {
            String status = field.substring(ArAgingProjection.STATUS_PREFIX.length());
            byStatus.put(status, value.longValue());
          }
        });
    return new ArAgingSummary(
        fields.getOrDefault(ArAgingProjection.TOTAL_INVOICES, BigDecimal.ZERO).longValue(),
        fields.getOrDefault(ArAgingProjection.TOTAL_AR, BigDecimal.ZERO),
        fields.getOrDefault(ArAgingProjection.TOTAL_COLLECTED, BigDecimal.ZERO),
        Map.copyOf(byStatus));
  }
}
