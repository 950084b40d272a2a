package com.keystone.events;

import java.util.List;

/**
 * Thrown when a fixed-type {@link EventBus} is asked to bind or dispatch an event type that was
 * not declared.
 */
public class UnknownEventTypeException extends RuntimeException {

    private final String eventType;
    private final List<String> declaredTypes;

    public UnknownEventTypeException(String eventType, List<String> declaredTypes) {
        super("Given %s, but expected %s".formatted(eventType, String.join(", ", declaredTypes)));
        this.eventType = eventType;
        this.declaredTypes = List.copyOf(declaredTypes);
    }

    public String eventType() {
        return eventType;
    }

    public List<String> declaredTypes() {
        return declaredTypes;
    }
}
