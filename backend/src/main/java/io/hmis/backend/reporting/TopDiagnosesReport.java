package io.hmis.backend.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.hmis.backend.projection.DiagnosisCount;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopDiagnosesReport(
    List<DiagnosisFrequency> topDiagnoses, List<DiagnosisCount> cachedTopDiagnoses) {

  public record DiagnosisFrequency(
      String icd10Code, String description, long totalOccurrences, long uniquePatients) {}
}
