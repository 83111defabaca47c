package io.hmis.backend.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryEventLogStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final InMemoryEventLogStore store =
      new InMemoryEventLogStore(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void unknownStreamIsAbsentAndEmpty() {
    assertThat(store.exists("events:Invoice")).isFalse();
    assertThat(store.length("events:Invoice")).isZero();
    assertThat(store.latest("events:Invoice", 5)).isEmpty();
  }

  @Test
  void appendCreatesStreamWithIncreasingIds() {
    String first = store.append("events:Invoice", Map.of("data", "{}"), 100);
    String second = store.append("events:Invoice", Map.of("data", "{}"), 100);

    assertThat(store.exists("events:Invoice")).isTrue();
    assertThat(store.length("events:Invoice")).isEqualTo(2);
    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void streamIsTrimmedToCapacityDroppingOldestEntries() {
    for (int i = 0; i < 10; i++) {
      store.append("events:Payment", Map.of("n", String.valueOf(i)), 3);
    }

    assertThat(store.length("events:Payment")).isEqualTo(3);
    assertThat(store.latest("events:Payment", 10))
        .extracting(entry -> entry.field("n"))
        .containsExactly("9", "8", "7");
  }

  @Test
  void latestReturnsNewestFirstUpToCount() {
    for (int i = 0; i < 5; i++) {
      store.append("events:dlq", Map.of("n", String.valueOf(i)), 100);
    }

    var latest = store.latest("events:dlq", 2);

    assertThat(latest).extracting(entry -> entry.field("n")).containsExactly("4", "3");
    assertThat(latest.get(0).stream()).isEqualTo("events:dlq");
    assertThat(latest.get(0).appendedAt()).isEqualTo(NOW);
  }

  @Test
  void streamsAreIndependent() {
    store.append("events:Invoice", Map.of("data", "a"), 1);
    store.append("events:Payment", Map.of("data", "b"), 1);
    store.append("events:Payment", Map.of("data", "c"), 1);

    assertThat(store.latest("events:Invoice", 5))
        .extracting(entry -> entry.field("data"))
        .containsExactly("a");
    assertThat(store.latest("events:Payment", 5))
        .extracting(entry -> entry.field("data"))
        .containsExactly("c");
  }
}
