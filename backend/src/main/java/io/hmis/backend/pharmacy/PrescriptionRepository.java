package io.hmis.backend.pharmacy;

import io.hmis.backend.multitenancy.TenantSession;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class PrescriptionRepository {

  /** Locks the prescription row until the session's transaction ends. */
  public Optional<Prescription> findByIdForUpdate(TenantSession session, UUID prescriptionId) {
    return session
        .jdbc()
        .sql(
            """
            SELECT id, patient_id, medication_name, quantity_prescribed, quantity_dispensed, status
            FROM prescriptions WHERE id = ?
            FOR UPDATE
            """)
        .param(prescriptionId)
        .query(
            (rs, rowNum) ->
                new Prescription(
                    rs.getObject("id", UUID.class),
                    rs.getObject("patient_id", UUID.class),
                    rs.getString("medication_name"),
                    rs.getInt("quantity_prescribed"),
                    rs.getInt("quantity_dispensed"),
                    rs.getString("status")))
        .optional();
  }

  public void updateDispensed(
      TenantSession session, UUID prescriptionId, int quantityDispensed, String status) {
    session
        .jdbc()
        .sql("UPDATE prescriptions SET quantity_dispensed = ?, status = ? WHERE id = ?")
        .params(quantityDispensed, status, prescriptionId)
        .update();
  }

  public void insertDispensation(TenantSession session, DispensationRecord record, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO dispensation_records
                (id, prescription_id, quantity_dispensed, dispensed_by, dispensed_at, notes,
                 status, created_by)
            VALUES (?, ?, ?, ?, ?, ?, 'dispensed', ?)
            """)
        .params(
            record.id(),
            record.prescriptionId(),
            record.quantityDispensed(),
            record.dispensedBy(),
            Timestamp.from(record.dispensedAt()),
            record.notes(),
            createdBy)
        .update();
  }
}
