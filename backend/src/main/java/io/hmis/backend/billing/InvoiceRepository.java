package io.hmis.backend.billing;

import io.hmis.backend.multitenancy.TenantSession;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/** Invoice, charge item and payment rows. Every call runs on the caller's tenant session. */
@Repository
public class InvoiceRepository {

  private static final String INVOICE_COLUMNS =
      """
      id, patient_id, encounter_id, invoice_number, subtotal, tax_amount, grand_total,
      amount_paid, balance_due, status, created_at
      """;

  public void insertInvoice(TenantSession session, Invoice invoice, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO invoices
                (id, patient_id, encounter_id, invoice_number, subtotal, tax_amount, grand_total,
                 amount_paid, balance_due, status, created_by, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)
        .params(
            invoice.id(),
            invoice.patientId(),
            invoice.encounterId(),
            invoice.invoiceNumber(),
            invoice.subtotal(),
            invoice.taxAmount(),
            invoice.grandTotal(),
            invoice.amountPaid(),
            invoice.balanceDue(),
            invoice.status().dbValue(),
            createdBy,
            Timestamp.from(invoice.createdAt()),
            Timestamp.from(invoice.createdAt()))
        .update();
  }

  public void insertChargeItem(
      TenantSession session, ChargeItem item, UUID encounterId, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO charge_items
                (id, invoice_id, encounter_id, service_code, description, quantity, unit_price,
                 total, status, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'invoiced', ?)
            """)
        .params(
            item.id(),
            item.invoiceId(),
            encounterId,
            item.serviceCode(),
            item.description(),
            item.quantity(),
            item.unitPrice(),
            item.total(),
            createdBy)
        .update();
  }

  public Optional<Invoice> findById(TenantSession session, UUID invoiceId) {
    return session
        .jdbc()
        .sql("SELECT " + INVOICE_COLUMNS + " FROM invoices WHERE id = ? AND is_active = true")
        .param(invoiceId)
        .query(InvoiceRepository::mapInvoice)
        .optional();
  }

  /** Locks the invoice row until the session's transaction ends. */
  public Optional<Invoice> findByIdForUpdate(TenantSession session, UUID invoiceId) {
    return session
        .jdbc()
        .sql(
            "SELECT "
                + INVOICE_COLUMNS
                + " FROM invoices WHERE id = ? AND is_active = true FOR UPDATE")
        .param(invoiceId)
        .query(InvoiceRepository::mapInvoice)
        .optional();
  }

  public List<ChargeItem> findChargeItems(TenantSession session, UUID invoiceId) {
    return session
        .jdbc()
        .sql(
            """
            SELECT id, invoice_id, service_code, description, quantity, unit_price, total
            FROM charge_items WHERE invoice_id = ? ORDER BY created_at, id
            """)
        .param(invoiceId)
        .query(
            (rs, rowNum) ->
                new ChargeItem(
                    rs.getObject("id", UUID.class),
                    rs.getObject("invoice_id", UUID.class),
                    rs.getString("service_code"),
                    rs.getString("description"),
                    rs.getInt("quantity"),
                    rs.getBigDecimal("unit_price"),
                    rs.getBigDecimal("total")))
        .list();
  }

  public void updatePaymentTotals(
      TenantSession session,
      UUID invoiceId,
      BigDecimal amountPaid,
      BigDecimal balanceDue,
      InvoiceStatus status) {
    session
        .jdbc()
        .sql(
            """
            UPDATE invoices
            SET amount_paid = ?, balance_due = ?, status = ?, updated_at = now()
            WHERE id = ?
            """)
        .params(amountPaid, balanceDue, status.dbValue(), invoiceId)
        .update();
  }

  public void insertPayment(TenantSession session, Payment payment, UUID createdBy) {
    session
        .jdbc()
        .sql(
            """
            INSERT INTO payments
                (id, invoice_id, amount, payment_method, reference_number, status, received_at,
                 created_by)
            VALUES (?, ?, ?, ?, ?, 'completed', ?, ?)
            """)
        .params(
            payment.id(),
            payment.invoiceId(),
            payment.amount(),
            payment.paymentMethod(),
            payment.referenceNumber(),
            Timestamp.from(payment.receivedAt()),
            createdBy)
        .update();
  }

  private static Invoice mapInvoice(ResultSet rs, int rowNum) throws SQLException {
    return new Invoice(
        rs.getObject("id", UUID.class),
        rs.getObject("patient_id", UUID.class),
        rs.getObject("encounter_id", UUID.class),
        rs.getString("invoice_number"),
        rs.getBigDecimal("subtotal"),
        rs.getBigDecimal("tax_amount"),
        rs.getBigDecimal("grand_total"),
        rs.getBigDecimal("amount_paid"),
        rs.getBigDecimal("balance_due"),
        InvoiceStatus.fromDb(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant());
  }
}
