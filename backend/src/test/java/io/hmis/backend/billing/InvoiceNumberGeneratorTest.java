package io.hmis.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InvoiceNumberGeneratorTest {

  @Test
  void numberCarriesDateAndSixHexDigits() {
    var generator =
        new InvoiceNumberGenerator(
            Clock.fixed(Instant.parse("2026-12-31T23:00:00Z"), ZoneOffset.UTC));

    assertThat(generator.next()).matches("INV-20261231-[0-9A-F]{6}");
  }

  @Test
  void onlyPendingAndPartialInvoicesAcceptPayment() {
    assertThat(InvoiceStatus.PENDING.acceptsPayment()).isTrue();
    assertThat(InvoiceStatus.PARTIAL.acceptsPayment()).isTrue();
    assertThat(InvoiceStatus.PAID.acceptsPayment()).isFalse();
    assertThat(InvoiceStatus.CANCELLED.acceptsPayment()).isFalse();
    assertThat(InvoiceStatus.fromDb("partial")).isEqualTo(InvoiceStatus.PARTIAL);
    assertThat(InvoiceStatus.PAID.dbValue()).isEqualTo("paid");
  }
}
