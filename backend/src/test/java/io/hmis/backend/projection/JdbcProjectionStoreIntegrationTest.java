package io.hmis.backend.projection;

import static org.assertj.core.api.Assertions.assertThat;

import io.hmis.backend.TestcontainersConfiguration;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JdbcProjectionStoreIntegrationTest {

  @Autowired
  @Qualifier("appDataSource")
  private DataSource dataSource;

  private final SettableClock clock = new SettableClock(Instant.parse("2026-03-01T10:00:00Z"));
  private JdbcProjectionStore store;

  @BeforeEach
  void setUp() {
    store = new JdbcProjectionStore(dataSource, clock);
  }

  @Test
  void incrementsAccumulateAtomicallyPerKey() {
    String key = "projection:ar_aging:jdbc-probe-" + System.nanoTime();
    store.hashIncrement(
        key,
        Map.of("total_invoices", BigDecimal.ONE, "total_ar", new BigDecimal("1000.00")),
        ttl());
    store.hashIncrement(
        key,
        Map.of("total_ar", new BigDecimal("-400.00"), "total_collected", new BigDecimal("400.00")),
        ttl());

    var values = store.hashGetAll(key).orElseThrow();
    assertThat(values.get("total_invoices")).isEqualByComparingTo("1");
    assertThat(values.get("total_ar")).isEqualByComparingTo("600.00");
    assertThat(values.get("total_collected")).isEqualByComparingTo("400.00");
    assertThat(store.hashGetAll(key + "-other")).isEmpty();
  }

  @Test
  void expiredKeyReadsAsMissAndRestartsFromZero() {
    String key = "projection:revenue:jdbc-probe-" + System.nanoTime();
    store.hashIncrement(key, Map.of("invoice_count", BigDecimal.ONE), ttl());

    clock.advance(Duration.ofMinutes(61));

    assertThat(store.hashGetAll(key)).isEmpty();

    store.hashIncrement(key, Map.of("invoice_count", BigDecimal.ONE), ttl());

    assertThat(store.hashGetAll(key).orElseThrow().get("invoice_count"))
        .isEqualByComparingTo("1");
  }

  @Test
  void writeRefreshesExpiryOfEveryField() {
    String key = "projection:ar_aging:jdbc-refresh-" + System.nanoTime();
    store.hashIncrement(key, Map.of("total_invoices", BigDecimal.ONE), ttl());
    clock.advance(Duration.ofMinutes(50));
    store.hashIncrement(key, Map.of("total_ar", BigDecimal.TEN), ttl());
    clock.advance(Duration.ofMinutes(50));

    assertThat(store.hashGetAll(key).orElseThrow()).containsOnlyKeys("total_invoices", "total_ar");
  }

  @Test
  void rankingOrdersByScore() {
    String key = "projection:diagnoses:jdbc-probe-" + System.nanoTime();
    store.rankIncrement(key, "J06.9", BigDecimal.ONE, ttl());
    store.rankIncrement(key, "I10", BigDecimal.ONE, ttl());
    store.rankIncrement(key, "I10", BigDecimal.ONE, ttl());

    assertThat(store.rankTop(key, 1))
        .singleElement()
        .satisfies(
            top -> {
              assertThat(top.member()).isEqualTo("I10");
              assertThat(top.score()).isEqualByComparingTo("2");
            });
  }

  @Test
  void concurrentInvoicesAndPaymentsOnOneKeyLoseNoIncrement() throws Exception {
    String key = "projection:ar_aging:jdbc-concurrent-" + System.nanoTime();
    int rounds = 40;
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> writes = new ArrayList<>();
      for (int i = 0; i < rounds; i++) {
        writes.add(
            executor.submit(
                () ->
                    store.hashIncrement(
                        key,
                        Map.of(
                            "total_invoices", BigDecimal.ONE,
                            "total_ar", new BigDecimal("100.00"),
                            "status:pending", BigDecimal.ONE),
                        ttl())));
        writes.add(
            executor.submit(
                () ->
                    store.hashIncrement(
                        key,
                        Map.of(
                            "total_ar", new BigDecimal("-40.00"),
                            "total_collected", new BigDecimal("40.00")),
                        ttl())));
      }
      for (Future<?> write : writes) {
        write.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    var values = store.hashGetAll(key).orElseThrow();
    assertThat(values.get("total_invoices")).isEqualByComparingTo("40");
    assertThat(values.get("status:pending")).isEqualByComparingTo("40");
    assertThat(values.get("total_ar")).isEqualByComparingTo("2400.00");
    assertThat(values.get("total_collected")).isEqualByComparingTo("1600.00");
  }

  private static Duration ttl() {
    return Duration.ofHours(1);
  }

  private static final class SettableClock extends Clock {

    private Instant now;

    SettableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
