package io.hmis.backend.event;

/** A handler plus the name used to identify it in logs and dead letters. */
public record RegisteredHandler(String name, DomainEventHandler handler) {}
