package io.hmis.backend.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.hmis.backend.projection.DailyRevenue;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevenueReport(
    String period,
    String groupBy,
    List<RevenuePeriod> timeSeries,
    List<PaymentMethodTotal> paymentMethods,
    List<DailyRevenue> cachedDailySummaries) {

  public record RevenuePeriod(
      LocalDate period,
      long invoiceCount,
      BigDecimal totalRevenue,
      BigDecimal revenueCollected,
      BigDecimal revenueOutstanding,
      BigDecimal collectionRate) {}

  public record PaymentMethodTotal(String method, long count, BigDecimal total) {}
}
