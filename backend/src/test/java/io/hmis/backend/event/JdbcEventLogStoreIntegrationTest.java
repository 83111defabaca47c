package io.hmis.backend.event;

import static org.assertj.core.api.Assertions.assertThat;

import io.hmis.backend.TestcontainersConfiguration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JdbcEventLogStoreIntegrationTest {

  @Autowired private EventLogStore store;

  @Test
  void jdbcBackendIsTheDefault() {
    assertThat(store).isInstanceOf(JdbcEventLogStore.class);
  }

  @Test
  void appendTrimsOldestEntriesPastCap() {
    String stream = "events:CapProbe";
    for (int i = 0; i < 7; i++) {
      store.append(stream, Map.of("n", String.valueOf(i)), 4);
    }

    assertThat(store.length(stream)).isEqualTo(4);
    assertThat(store.latest(stream, 10))
        .extracting(entry -> entry.field("n"))
        .containsExactly("6", "5", "4", "3");
  }

  @Test
  void fieldsRoundTripThroughJsonb() {
    String stream = "events:FieldProbe";
    store.append(stream, Map.of("data", "{\"event_type\":\"x\"}", "handler", "H.on"), 10);

    var entry = store.latest(stream, 1).get(0);

    assertThat(entry.stream()).isEqualTo(stream);
    assertThat(entry.fields())
        .containsEntry("data", "{\"event_type\":\"x\"}")
        .containsEntry("handler", "H.on");
    assertThat(entry.appendedAt()).isNotNull();
  }

  @Test
  void streamExistsOnlyAfterFirstAppend() {
    String stream = "events:ExistsProbe";
    assertThat(store.exists(stream)).isFalse();
    assertThat(store.length(stream)).isZero();

    store.append(stream, Map.of("n", "1"), 10);

    assertThat(store.exists(stream)).isTrue();
  }
}
