package com.keystone.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler that re-dispatches every event it receives to another bus under a fixed event type.
 *
 * <p>The same event instance is forwarded, so stopping propagation on the target bus is visible
 * to the remaining handlers of the origin bus.
 */
public final class EventRelay implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(EventRelay.class);

    private final EventBus target;
    private final String eventType;

    public EventRelay(EventBus target, String eventType) {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be null or blank");
        }
        this.target = target;
        this.eventType = eventType;
    }

    @Override
    public void handle(Event event) {
        log.debug("Relaying {} to {}", eventType, target);
        target.dispatch(eventType, event);
    }

    public EventBus target() {
        return target;
    }

    public String eventType() {
        return eventType;
    }

    @Override
    public String toString() {
        return "EventRelay{" + eventType + " -> " + target + "}";
    }
}
