package io.hmis.backend.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.hmis.backend.projection.ArAgingSummary;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArAgingReport(
    LocalDate asOfDate,
    long totalInvoices,
    BigDecimal totalAr,
    List<AgingBucket> agingSummary,
    ArAgingSummary cachedSummary) {

  public record AgingBucket(
      String bucket, long invoiceCount, BigDecimal totalBalance, BigDecimal percentage) {}
}
