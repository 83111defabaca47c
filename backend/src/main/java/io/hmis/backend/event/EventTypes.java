package io.hmis.backend.event;

/** Event type tags emitted across the system. */
public final class EventTypes {

  // Patients
  public static final String PATIENT_REGISTERED = "patient.registered";
  public static final String PATIENT_UPDATED = "patient.updated";

  // Appointments
  public static final String APPOINTMENT_CREATED = "appointment.created";
  public static final String APPOINTMENT_CONFIRMED = "appointment.confirmed";
  public static final String APPOINTMENT_CANCELLED = "appointment.cancelled";
  public static final String APPOINTMENT_COMPLETED = "appointment.completed";
  public static final String APPOINTMENT_NO_SHOW = "appointment.no_show";

  // Clinical record
  public static final String ENCOUNTER_CREATED = "encounter.created";
  public static final String ENCOUNTER_COMPLETED = "encounter.completed";
  public static final String DIAGNOSIS_ADDED = "diagnosis.added";
  public static final String CLINICAL_NOTE_SIGNED = "clinical_note.signed";
  public static final String ORDER_CREATED = "medical_order.created";

  // Billing
  public static final String CHARGE_CREATED = "charge.created";
  public static final String INVOICE_GENERATED = "invoice.generated";
  public static final String PAYMENT_RECEIVED = "payment.received";
  public static final String CLAIM_SUBMITTED = "insurance_claim.submitted";
  public static final String CLAIM_ADJUDICATED = "insurance_claim.adjudicated";

  // Pharmacy
  public static final String PRESCRIPTION_CREATED = "prescription.created";
  public static final String MEDICATION_DISPENSED = "medication.dispensed";
  public static final String STOCK_LOW = "stock.low_alert";
  public static final String STOCK_EXPIRED = "stock.expiration_alert";

  // Clinical decision support
  public static final String CDS_ALERT_GENERATED = "cds.alert_generated";
  public static final String CDS_ALERT_OVERRIDDEN = "cds.alert_overridden";

  private EventTypes() {}
}
