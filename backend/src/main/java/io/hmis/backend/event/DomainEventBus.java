package io.hmis.backend.event;

import io.hmis.backend.deadletter.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process publish/subscribe. {@link #publish} appends the event to the durable log stream of
 * its aggregate type, then runs every handler registered for its event type, in registration
 * order, on the calling thread.
 *
 * <p>Nothing raised below this class reaches the publisher. A failed log append is logged and
 * dispatch continues; a failed handler is logged, optionally dead-lettered, and the next handler
 * runs. There is no retry.
 */
@Component
public class DomainEventBus {

  private static final Logger log = LoggerFactory.getLogger(DomainEventBus.class);

  private final EventHandlerRegistry registry;
  private final EventLogStore logStore;
  private final EventCodec codec;
  private final DeadLetterQueue deadLetterQueue;
  private final EventBusProperties properties;

  public DomainEventBus(
      EventHandlerRegistry registry,
      EventLogStore logStore,
      EventCodec codec,
      DeadLetterQueue deadLetterQueue,
      EventBusProperties properties) {
    this.registry = registry;
    this.logStore = logStore;
    this.codec = codec;
    this.deadLetterQueue = deadLetterQueue;
    this.properties = properties;
  }

  public void publish(DomainEvent event) {
    appendToLog(event);

    var handlers = registry.handlersFor(event.eventType());
    if (handlers.isEmpty()) {
      log.debug("No handlers for eventType={}, eventId={}", event.eventType(), event.eventId());
      return;
    }
    for (RegisteredHandler handler : handlers) {
      try {
        handler.handler().handle(event);
      } catch (RuntimeException e) {
        log.error(
            "Event handler failed: eventType={}, eventId={}, handler={}, aggregateType={},"
                + " aggregateId={}, tenantId={}",
            event.eventType(),
            event.eventId(),
            handler.name(),
            event.aggregateType(),
            event.aggregateId(),
            event.tenantId(),
            e);
        deadLetter(event, handler.name(), e);
      }
    }
  }

  /** Convenience for registration code that does not need the registry directly. */
  public boolean subscribe(String eventType, String handlerName, DomainEventHandler handler) {
    return registry.subscribe(eventType, handlerName, handler);
  }

  private void appendToLog(DomainEvent event) {
    String stream = properties.streamFor(event.aggregateType());
    try {
      String entryId =
          logStore.append(stream, codec.toLogFields(event), properties.streamMaxLength());
      log.debug(
          "Event appended: stream={}, entryId={}, eventType={}, eventId={}",
          stream,
          entryId,
          event.eventType(),
          event.eventId());
    } catch (RuntimeException e) {
      log.error(
          "Failed to append event to durable log: stream={}, eventType={}, eventId={}",
          stream,
          event.eventType(),
          event.eventId(),
          e);
    }
  }

  private void deadLetter(DomainEvent event, String handlerName, RuntimeException failure) {
    if (!properties.deadLetterOnFailure()) {
      return;
    }
    try {
      deadLetterQueue.record(event, handlerName, failure);
    } catch (RuntimeException e) {
      log.error(
          "Failed to write dead letter: eventType={}, eventId={}, handler={}",
          event.eventType(),
          event.eventId(),
          handlerName,
          e);
    }
  }
}
