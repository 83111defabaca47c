package io.hmis.backend.billing;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record RecordPaymentCommand(
    @NotNull @Positive BigDecimal amount,
    @NotBlank @Size(max = 30) String paymentMethod,
    @Size(max = 100) String referenceNumber) {}
