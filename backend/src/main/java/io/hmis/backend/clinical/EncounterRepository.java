package io.hmis.backend.clinical;

import io.hmis.backend.multitenancy.TenantSession;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class EncounterRepository {

  public void insertEncounter(TenantSession session, Encounter encounter, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO encounters
                (id, patient_id, provider_id, encounter_type, reason, status, start_datetime,
                 created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """)
        .params(
            encounter.id(),
            encounter.patientId(),
            encounter.providerId(),
            encounter.encounterType(),
            encounter.reason(),
            encounter.status(),
            Timestamp.from(encounter.startDatetime()),
            createdBy)
        .update();
  }

  public Optional<Encounter> findById(TenantSession session, UUID encounterId) {
    return session
        .jdbc()
        .sql(
            """
            SELECT id, patient_id, provider_id, encounter_type, reason, status, start_datetime
            FROM encounters WHERE id = ? AND is_active = true
            """)
        .param(encounterId)
        .query(
            (rs, rowNum) ->
                new Encounter(
                    rs.getObject("id", UUID.class),
                    rs.getObject("patient_id", UUID.class),
                    rs.getObject("provider_id", UUID.class),
                    rs.getString("encounter_type"),
                    rs.getString("reason"),
                    rs.getString("status"),
                    rs.getTimestamp("start_datetime").toInstant()))
        .optional();
  }

  public void insertDiagnosis(TenantSession session, Diagnosis diagnosis, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO diagnoses
                (id, encounter_id, patient_id, icd10_code, description, is_primary, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """)
        .params(
            diagnosis.id(),
            diagnosis.encounterId(),
            diagnosis.patientId(),
            diagnosis.icd10Code(),
            diagnosis.description(),
            diagnosis.primary(),
            createdBy)
        .update();
  }
}
