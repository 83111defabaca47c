package io.hmis.backend.billing;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record Payment(
    UUID id,
    UUID invoiceId,
    BigDecimal amount,
    String paymentMethod,
    String referenceNumber,
    Instant receivedAt) {}
