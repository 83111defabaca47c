package io.hmis.backend.event;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide table of event type to ordered handlers. Populated during startup, then frozen into
 * an immutable snapshot that in-flight requests read without locking. Registering the same
 * (event type, handler name) pair twice is a no-op.
 */
@Component
public class EventHandlerRegistry {

  private static final Logger log = LoggerFactory.getLogger(EventHandlerRegistry.class);

  private final Map<String, List<RegisteredHandler>> pending = new LinkedHashMap<>();
  private final Set<String> registeredKeys = new HashSet<>();
  private volatile Map<String, List<RegisteredHandler>> frozen;

  /** Returns {@code false} when this handler was already registered for the event type. */
  public synchronized boolean subscribe(
      String eventType, String handlerName, DomainEventHandler handler) {
    if (frozen != null) {
      throw new IllegalStateException(
          "Handler registry is frozen; cannot subscribe " + handlerName + " to " + eventType);
    }
    if (!registeredKeys.add(eventType + "|" + handlerName)) {
      log.debug(
          "Ignoring duplicate registration: eventType={}, handler={}", eventType, handlerName);
      return false;
    }
    pending
        .computeIfAbsent(eventType, type -> new ArrayList<>())
        .add(new RegisteredHandler(handlerName, handler));
    log.debug("Registered handler: eventType={}, handler={}", eventType, handlerName);
    return true;
  }

  /** Ends the registration phase. Idempotent. */
  public synchronized void freeze() {
    if (frozen != null) {
      return;
    }
    var snapshot = new LinkedHashMap<String, List<RegisteredHandler>>();
    pending.forEach((type, handlers) -> snapshot.put(type, List.copyOf(handlers)));
    frozen = Map.copyOf(snapshot);
    log.info(
        "Event handler registry frozen: {} event types, {} handlers",
        frozen.size(),
        registeredKeys.size());
  }

  public boolean isFrozen() {
    return frozen != null;
  }

  public List<RegisteredHandler> handlersFor(String eventType) {
    var snapshot = frozen;
    if (snapshot != null) {
      return snapshot.getOrDefault(eventType, List.of());
    }
    synchronized (this) {
      return List.copyOf(pending.getOrDefault(eventType, List.of()));
    }
  }

  public synchronized Set<String> eventTypes() {
    return Set.copyOf(frozen != null ? frozen.keySet() : pending.keySet());
  }
}
