package io.hmis.backend.billing;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record CreateInvoiceCommand(
    @NotNull UUID patientId,
    UUID encounterId,
    @NotEmpty List<@Valid ChargeLine> chargeItems,
    @NotNull @DecimalMin("0.00") @DecimalMax("1.00") BigDecimal taxRate) {

  public record ChargeLine(
      @Size(max = 32) String serviceCode,
      @NotBlank @Size(max = 500) String description,
      @Positive int quantity,
      @NotNull @PositiveOrZero BigDecimal unitPrice) {

    public BigDecimal total() {
      return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
  }
}
