package io.hmis.backend.reporting;

import io.hmis.backend.multitenancy.ReadPath;
import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import io.hmis.backend.projection.ArAgingProjection;
import io.hmis.backend.projection.DailyRevenue;
import io.hmis.backend.projection.RevenueProjection;
import io.hmis.backend.reporting.ArAgingReport.AgingBucket;
import io.hmis.backend.reporting.RevenueReport.PaymentMethodTotal;
import io.hmis.backend.reporting.RevenueReport.RevenuePeriod;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Billing reports computed on the read path the query asks for (the replica by default) and
 * enriched with cached projections when they are present. Replica lag is tolerated.
 */
@Service
public class BillingQueryHandler {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final TenantSessionProvider sessions;
  private final ArAgingProjection arAgingProjection;
  private final RevenueProjection revenueProjection;

  public BillingQueryHandler(
      TenantSessionProvider sessions,
      ArAgingProjection arAgingProjection,
      RevenueProjection revenueProjection) {
    this.sessions = sessions;
    this.arAgingProjection = arAgingProjection;
    this.revenueProjection = revenueProjection;
  }

  /** Outstanding balances of pending and partially paid invoices, grouped by age. */
  public ArAgingReport arAging(TenantContext context, ArAgingQuery query) {
    String tenantId = context.requireTenantId();
    List<String> labels = bucketLabels(query.agingBuckets());

    List<AgingBucket> rows =
        sessions.readOnly(
            context,
            query.readPath(),
            session ->
                session
                    .jdbc()
                    .sql(
                        """
                        SELECT %s AS aging_bucket,
                               count(*) AS invoice_count,
                               coalesce(sum(balance_due), 0) AS total_balance
                        FROM (SELECT (CAST(? AS date) - CAST(created_at AS date)) AS age_days,
                                     balance_due
                              FROM invoices
                              WHERE is_active = true
                                AND status IN ('pending', 'partial')
                                AND balance_due > 0) aged
                        GROUP BY aging_bucket
                        """
                            .formatted(bucketCase(query.agingBuckets())))
                    .param(query.asOfDate())
                    .query(
                        (rs, rowNum) ->
                            new AgingBucket(
                                rs.getString("aging_bucket"),
                                rs.getLong("invoice_count"),
                                rs.getBigDecimal("total_balance"),
                                BigDecimal.ZERO))
                    .list());

    long totalInvoices = rows.stream().mapToLong(AgingBucket::invoiceCount).sum();
    BigDecimal totalAr =
        rows.stream().map(AgingBucket::totalBalance).reduce(BigDecimal.ZERO, BigDecimal::add);
    List<AgingBucket> buckets =
        rows.stream()
            .sorted(Comparator.comparingInt(row -> labels.indexOf(row.bucket())))
            .map(
                row ->
                    new AgingBucket(
                        row.bucket(),
                        row.invoiceCount(),
                        row.totalBalance(),
                        percentage(row.totalBalance(), totalAr)))
            .toList();

    return new ArAgingReport(
        query.asOfDate(),
        totalInvoices,
        totalAr,
        buckets,
        arAgingProjection.summary(tenantId).orElse(null));
  }

  /** Invoiced, collected and outstanding totals per period, with a payment-method breakdown. */
  public RevenueReport revenueAnalysis(TenantContext context, RevenueAnalysisQuery query) {
    String tenantId = context.requireTenantId();
    String unit = query.groupBy().truncUnit();

    var result =
        sessions.readOnly(
            context,
            query.readPath(),
            session -> {
              List<RevenuePeriod> periods =
                  session
                      .jdbc()
                      .sql(
                          """
                          SELECT CAST(date_trunc('%s', created_at) AS date) AS period,
                                 count(*) AS invoice_count,
                                 coalesce(sum(grand_total), 0) AS total_revenue,
                                 coalesce(sum(CASE WHEN status = 'paid' THEN grand_total
                                                   ELSE 0 END), 0) AS revenue_collected,
                                 coalesce(sum(balance_due), 0) AS revenue_outstanding
                          FROM invoices
                          WHERE is_active = true
                            AND created_at >= CAST(? AS date)
                            AND created_at < CAST(? AS date) + 1
                          GROUP BY period
                          ORDER BY period
                          """
                              .formatted(unit))
                      .params(query.startDate(), query.endDate())
                      .query(
                          (rs, rowNum) -> {
                            BigDecimal total = rs.getBigDecimal("total_revenue");
                            BigDecimal collected = rs.getBigDecimal("revenue_collected");
                            return new RevenuePeriod(
                                rs.getObject("period", LocalDate.class),
                                rs.getLong("invoice_count"),
                                total,
                                collected,
                                rs.getBigDecimal("revenue_outstanding"),
                                percentage(collected, total));
                          })
                      .list();
              List<PaymentMethodTotal> methods =
                  session
                      .jdbc()
                      .sql(
                          """
                          SELECT payment_method, count(*) AS payment_count,
                                 coalesce(sum(amount), 0) AS total
                          FROM payments
                          WHERE is_active = true
                            AND received_at >= CAST(? AS date)
                            AND received_at < CAST(? AS date) + 1
                          GROUP BY payment_method
                          ORDER BY payment_method
                          """)
                      .params(query.startDate(), query.endDate())
                      .query(
                          (rs, rowNum) ->
                              new PaymentMethodTotal(
                                  rs.getString("payment_method"),
                                  rs.getLong("payment_count"),
                                  rs.getBigDecimal("total")))
                      .list();
              return new RevenueReport(
                  query.startDate() + " to " + query.endDate(), unit, periods, methods, null);
            });

    if (query.groupBy() != RevenueGrouping.DAY) {
      return result;
    }
    return new RevenueReport(
        result.period(),
        result.groupBy(),
        result.timeSeries(),
        result.paymentMethods(),
        revenueProjection.dailyRevenue(tenantId, query.startDate(), query.endDate()));
  }

  /**
   * One day's revenue from the projection, or computed from invoices and payments of that day when
   * the projection has no bucket for it.
   */
  public DailyRevenueReport dailyRevenue(TenantContext context, LocalDate date, ReadPath path) {
    String tenantId = context.requireTenantId();
    var cached = revenueProjection.dailyRevenue(tenantId, date);
    if (cached.isPresent()) {
      return new DailyRevenueReport(cached.get(), DailyRevenueReport.Source.PROJECTION);
    }
    var computed =
        sessions.readOnly(
            context,
            path,
            session ->
                session
                    .jdbc()
                    .sql(
                        """
                        SELECT
                          (SELECT coalesce(sum(grand_total), 0) FROM invoices
                            WHERE is_active = true AND created_at >= CAST(:day AS date)
                              AND created_at < CAST(:day AS date) + 1) AS total_invoiced,
                          (SELECT count(*) FROM invoices
                            WHERE is_active = true AND created_at >= CAST(:day AS date)
                              AND created_at < CAST(:day AS date) + 1) AS invoice_count,
                          (SELECT coalesce(sum(amount), 0) FROM payments
                            WHERE is_active = true AND received_at >= CAST(:day AS date)
                              AND received_at < CAST(:day AS date) + 1) AS total_collected,
                          (SELECT count(*) FROM payments
                            WHERE is_active = true AND received_at >= CAST(:day AS date)
                              AND received_at < CAST(:day AS date) + 1) AS payment_count
                        """)
                    .param("day", date)
                    .query(
                        (rs, rowNum) ->
                            new DailyRevenue(
                                date,
                                rs.getBigDecimal("total_invoiced"),
                                rs.getLong("invoice_count"),
                                rs.getBigDecimal("total_collected"),
                                rs.getLong("payment_count")))
                    .single());
    return new DailyRevenueReport(computed, DailyRevenueReport.Source.DATABASE);
  }

  static List<String> bucketLabels(List<Integer> bounds) {
    var labels = new ArrayList<String>();
    labels.add("Current");
    int previous = 0;
    for (int bound : bounds) {
      labels.add(previous + "-" + bound + " days");
      previous = bound;
    }
    labels.add(previous + "+ days");
    return labels;
  }

  /** Bounds are validated integers, so inlining them is safe. */
  static String bucketCase(List<Integer> bounds) {
    var sql = new StringBuilder("CASE");
    int previous = 0;
    for (int bound : bounds) {
      sql.append(" WHEN age_days >= ")
          .append(previous)
          .append(" AND age_days < ")
          .append(bound)
          .append(" THEN '")
          .append(previous)
          .append('-')
          .append(bound)
          .append(" days'");
      previous = bound;
    }
    sql.append(" WHEN age_days >= ")
        .append(previous)
        .append(" THEN '")
        .append(previous)
        .append("+ days'")
        .append(" ELSE 'Current' END");
    return sql.toString();
  }

  static BigDecimal percentage(BigDecimal part, BigDecimal total) {
    if (total == null || total.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return part.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
  }
}
