package io.hmis.backend.projection;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CaffeineProjectionStoreTest {

  private final AtomicLong nanos = new AtomicLong();
  private final CaffeineProjectionStore store = new CaffeineProjectionStore(nanos::get);

  @Test
  void hashIncrementAccumulatesFields() {
    store.hashIncrement("k", Map.of("a", BigDecimal.ONE, "b", new BigDecimal("2.50")), ttl());
    store.hashIncrement("k", Map.of("a", BigDecimal.ONE, "c", new BigDecimal("-1")), ttl());

    var values = store.hashGetAll("k").orElseThrow();

    assertThat(values.get("a")).isEqualByComparingTo("2");
    assertThat(values.get("b")).isEqualByComparingTo("2.50");
    assertThat(values.get("c")).isEqualByComparingTo("-1");
  }

  @Test
  void missingKeyIsEmpty() {
    assertThat(store.hashGetAll("nothing")).isEmpty();
    assertThat(store.rankTop("nothing", 10)).isEmpty();
  }

  @Test
  void entryExpiresAfterTtlSinceLastWrite() {
    store.hashIncrement("k", Map.of("a", BigDecimal.ONE), ttl());
    advance(Duration.ofMinutes(50));
    store.hashIncrement("k", Map.of("a", BigDecimal.ONE), ttl());
    advance(Duration.ofMinutes(50));

    assertThat(store.hashGetAll("k")).isPresent();

    advance(Duration.ofMinutes(11));

    assertThat(store.hashGetAll("k")).isEmpty();
  }

  @Test
  void readsDoNotExtendTtl() {
    store.hashIncrement("k", Map.of("a", BigDecimal.ONE), ttl());
    advance(Duration.ofMinutes(59));
    assertThat(store.hashGetAll("k")).isPresent();

    advance(Duration.ofMinutes(2));

    assertThat(store.hashGetAll("k")).isEmpty();
  }

  @Test
  void expiredAggregateRestartsFromZero() {
    store.hashIncrement("k", Map.of("a", BigDecimal.TEN), ttl());
    advance(Duration.ofHours(2));

    store.hashIncrement("k", Map.of("a", BigDecimal.ONE), ttl());

    assertThat(store.hashGetAll("k").orElseThrow().get("a")).isEqualByComparingTo("1");
  }

  @Test
  void rankTopOrdersByScoreThenMember() {
    store.rankIncrement("r", "J06.9", BigDecimal.ONE, ttl());
    store.rankIncrement("r", "I10", BigDecimal.ONE, ttl());
    store.rankIncrement("r", "I10", BigDecimal.ONE, ttl());
    store.rankIncrement("r", "E11.9", BigDecimal.ONE, ttl());

    assertThat(store.rankTop("r", 2))
        .extracting(RankedMember::member)
        .containsExactly("I10", "E11.9");
  }

  @Test
  void concurrentInvoicesAndPaymentsOnOneKeyLoseNoIncrement() throws Exception {
    String key = "projection:ar_aging:clinic-a";
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

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }
}
