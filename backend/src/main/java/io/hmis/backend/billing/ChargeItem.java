package io.hmis.backend.billing;

import java.math.BigDecimal;
import java.util.UUID;

public record ChargeItem(
    UUID id,
    UUID invoiceId,
    String serviceCode,
    String description,
    int quantity,
    BigDecimal unitPrice,
    BigDecimal total) {}
