package io.hmis.backend.projection;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hmis.backend.deadletter.DeadLetterQueue;
import io.hmis.backend.event.DomainEvent;
import io.hmis.backend.event.DomainEventBus;
import io.hmis.backend.event.EventBusProperties;
import io.hmis.backend.event.EventCodec;
import io.hmis.backend.event.EventHandlerRegistry;
import io.hmis.backend.event.EventTypes;
import io.hmis.backend.event.InMemoryEventLogStore;
import io.hmis.backend.event.RegisteredHandler;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectionRegistrarTest {

  private final ProjectionStore store = new CaffeineProjectionStore();
  private final ArAgingProjection arAging = new ArAgingProjection(store);
  private final DiagnosisTrendsProjection diagnoses = new DiagnosisTrendsProjection(store);
  private final RevenueProjection revenue = new RevenueProjection(store);
  private final EventHandlerRegistry registry = new EventHandlerRegistry();

  @Test
  void registersEveryProjectionThenFreezes() {
    new ProjectionRegistrar(registry, List.of(arAging, diagnoses, revenue))
        .afterSingletonsInstantiated();

    assertThat(registry.isFrozen()).isTrue();
    assertThat(registry.handlersFor(EventTypes.INVOICE_GENERATED))
        .extracting(RegisteredHandler::name)
        .containsExactly(
            "ArAgingProjection.onInvoiceGenerated", "RevenueProjection.onInvoiceGenerated");
    assertThat(registry.handlersFor(EventTypes.DIAGNOSIS_ADDED))
        .extracting(RegisteredHandler::name)
        .containsExactly("DiagnosisTrendsProjection.onDiagnosisAdded");
  }

  @Test
  void publishedEventsReachEveryProjection() {
    new ProjectionRegistrar(registry, List.of(arAging, diagnoses, revenue))
        .afterSingletonsInstantiated();
    var clock = Clock.systemUTC();
    var logStore = new InMemoryEventLogStore(clock);
    var codec = new EventCodec(new ObjectMapper().findAndRegisterModules());
    var properties = EventBusProperties.defaults();
    var bus =
        new DomainEventBus(
            registry,
            logStore,
            codec,
            new DeadLetterQueue(logStore, codec, properties, clock),
            properties);

    var invoice =
        DomainEvent.builder(EventTypes.INVOICE_GENERATED, "Invoice", 1L)
            .tenantId("clinic-a")
            .data("grand_total", new BigDecimal("1000.00"))
            .data("status", "pending")
            .build();
    var payment =
        DomainEvent.builder(EventTypes.PAYMENT_RECEIVED, "Payment", 1L)
            .tenantId("clinic-a")
            .timestamp(invoice.timestamp())
            .data("amount", new BigDecimal("400.00"))
            .build();
    bus.publish(invoice);
    bus.publish(payment);

    var summary = arAging.summary("clinic-a").orElseThrow();
    assertThat(summary.totalAr()).isEqualByComparingTo("600.00");
    assertThat(summary.totalCollected()).isEqualByComparingTo("400.00");
    var day = revenue.dailyRevenue("clinic-a", RevenueProjection.dayOf(invoice)).orElseThrow();
    assertThat(day.totalInvoiced()).isEqualByComparingTo("1000.00");
    assertThat(day.totalCollected()).isEqualByComparingTo("400.00");
    assertThat(logStore.length("events:Invoice")).isEqualTo(1);
    assertThat(logStore.length("events:Payment")).isEqualTo(1);
    assertThat(logStore.exists("events:dlq")).isFalse();
  }
}
