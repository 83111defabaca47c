package io.hmis.backend.projection;

import io.hmis.backend.event.EventHandlerRegistry;

/** A read-side view kept current by domain events. Registers its handlers once at startup. */
public interface ProjectionMaintainer {

  void register(EventHandlerRegistry registry);

  /** Handler identity used in logs and dead letters, e.g. {@code ArAgingProjection.onX}. */
  default String handlerName(String method) {
    return getClass().getSimpleName() + "." + method;
  }
}
