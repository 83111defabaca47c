package io.hmis.backend.billing;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record Invoice(
    UUID id,
    UUID patientId,
    UUID encounterId,
    String invoiceNumber,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal grandTotal,
    BigDecimal amountPaid,
    BigDecimal balanceDue,
    InvoiceStatus status,
    Instant createdAt) {}
