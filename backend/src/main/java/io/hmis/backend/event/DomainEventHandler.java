package io.hmis.backend.event;

@FunctionalInterface
public interface DomainEventHandler {

  void handle(DomainEvent event);
}
