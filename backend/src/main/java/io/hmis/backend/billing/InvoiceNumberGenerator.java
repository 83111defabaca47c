package io.hmis.backend.billing;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/** Produces numbers of the form {@code INV-yyyyMMdd-XXXXXX} with six random hex digits. */
@Component
public class InvoiceNumberGenerator {

  private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

  private final Clock clock;

  public InvoiceNumberGenerator(Clock clock) {
    this.clock = clock;
  }

  public String next() {
    var bytes = new byte[3];
    ThreadLocalRandom.current().nextBytes(bytes);
    return "INV-"
        + LocalDate.now(clock).format(DAY)
        + "-"
        + HexFormat.of().withUpperCase().formatHex(bytes);
  }
}
