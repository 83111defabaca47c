package io.hmis.backend.reporting;

import io.hmis.backend.multitenancy.TenantContext;
import io.hmis.backend.multitenancy.TenantSessionProvider;
import io.hmis.backend.projection.DiagnosisTrendsProjection;
import io.hmis.backend.reporting.TopDiagnosesReport.DiagnosisFrequency;
import org.springframework.stereotype.Service;

@Service
public class ClinicalQueryHandler {

  private final TenantSessionProvider sessions;
  private final DiagnosisTrendsProjection diagnosisTrends;

  public ClinicalQueryHandler(
      TenantSessionProvider sessions, DiagnosisTrendsProjection diagnosisTrends) {
    this.sessions = sessions;
    this.diagnosisTrends = diagnosisTrends;
  }

  /** Most frequent diagnoses with distinct-patient counts, plus the cached ranking if present. */
  public TopDiagnosesReport topDiagnoses(TenantContext context, TopDiagnosesQuery query) {
    String tenantId = context.requireTenantId();
    var cached = diagnosisTrends.topDiagnoses(tenantId, query.limit());

    var frequencies =
        sessions.readOnly(
            context,
            query.readPath(),
            session ->
                session
                    .jdbc()
                    .sql(
                        """
                        SELECT d.icd10_code, d.description,
                               count(d.id) AS total_occurrences,
                               count(DISTINCT d.patient_id) AS unique_patients
                        FROM diagnoses d
                        JOIN encounters e ON e.id = d.encounter_id
                        WHERE d.is_active = true
                          AND e.is_active = true
                          AND (CAST(:start AS date) IS NULL
                               OR e.start_datetime >= CAST(:start AS date))
                          AND (CAST(:end AS date) IS NULL
                               OR e.start_datetime < CAST(:end AS date) + 1)
                        GROUP BY d.icd10_code, d.description
                        ORDER BY total_occurrences DESC, d.icd10_code
                        LIMIT :limit
                        """)
                    .param("start", query.startDate())
                    .param("end", query.endDate())
                    .param("limit", query.limit())
                    .query(
                        (rs, rowNum) ->
                            new DiagnosisFrequency(
                                rs.getString("icd10_code"),
                                rs.getString("description"),
                                rs.getLong("total_occurrences"),
                                rs.getLong("unique_patients")))
                    .list());

    return new TopDiagnosesReport(frequencies, cached.orElse(null));
  }
}
