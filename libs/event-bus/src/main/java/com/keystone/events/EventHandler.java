package com.keystone.events;

/**
 * Receives events dispatched by an {@link EventBus}.
 *
 * <p>Handlers are compared by identity: registering the same instance twice for one event type has
 * no effect, and {@link EventBus#off(String, EventHandler)} removes the exact instance given.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles one event. Exceptions are not caught by the bus; they abort the dispatch and reach
     * the caller of {@link EventBus#dispatch(String, Event)}.
     */
    void handle(Event event);
}
