package io.hmis.backend.reporting;

import io.hmis.backend.multitenancy.ReadPath;
import io.hmis.backend.multitenancy.TenantContext;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Report endpoints. Every report reads from the replica unless {@code source=primary} is passed.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

  private final BillingQueryHandler billingQueries;
  private final ClinicalQueryHandler clinicalQueries;
  private final Clock clock;

  public ReportController(
      BillingQueryHandler billingQueries, ClinicalQueryHandler clinicalQueries, Clock clock) {
    this.billingQueries = billingQueries;
    this.clinicalQueries = clinicalQueries;
    this.clock = clock;
  }

  @GetMapping("/ar-aging")
  public ResponseEntity<ArAgingReport> arAging(
      TenantContext tenant,
      @RequestParam(name = "as_of_date", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOfDate,
      @RequestParam(name = "buckets", required = false) List<Integer> buckets,
      @RequestParam(name = "source", required = false) String source) {
    var query =
        new ArAgingQuery(
            asOfDate != null ? asOfDate : LocalDate.now(clock), buckets, readPath(source));
    return ResponseEntity.ok(billingQueries.arAging(tenant, query));
  }

  @GetMapping("/revenue-analysis")
  public ResponseEntity<RevenueReport> revenueAnalysis(
      TenantContext tenant,
      @RequestParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(name = "group_by", required = false) String groupBy,
      @RequestParam(name = "source", required = false) String source) {
    var query =
        new RevenueAnalysisQuery(
            startDate, endDate, RevenueGrouping.fromParam(groupBy), readPath(source));
    return ResponseEntity.ok(billingQueries.revenueAnalysis(tenant, query));
  }

  @GetMapping("/revenue/daily")
  public ResponseEntity<DailyRevenueReport> dailyRevenue(
      TenantContext tenant,
      @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date,
      @RequestParam(name = "source", required = false) String source) {
    return ResponseEntity.ok(
        billingQueries.dailyRevenue(
            tenant, date != null ? date : LocalDate.now(clock), readPath(source)));
  }

  @GetMapping("/top-diagnoses")
  public ResponseEntity<TopDiagnosesReport> topDiagnoses(
      TenantContext tenant,
      @RequestParam(name = "start_date", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam(name = "end_date", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate,
      @RequestParam(name = "limit", defaultValue = "20") int limit,
      @RequestParam(name = "source", required = false) String source) {
    var query = new TopDiagnosesQuery(startDate, endDate, limit, readPath(source));
    return ResponseEntity.ok(clinicalQueries.topDiagnoses(tenant, query));
  }

  static ReadPath readPath(String source) {
    return "primary".equalsIgnoreCase(source) ? ReadPath.PRIMARY : ReadPath.REPLICA;
  }
}
