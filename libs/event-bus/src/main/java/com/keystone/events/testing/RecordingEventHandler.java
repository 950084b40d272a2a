package com.keystone.events.testing;

import com.keystone.events.Event;
import com.keystone.events.EventBus;
import com.keystone.events.EventHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Handler that records every event it receives, in arrival order, together with its type.
 * <p>
 * Lives in {@code src/main/java} so that other modules can use it from their tests.
 */
public final class RecordingEventHandler {

    /**
     * One received event.
     *
     * @param type  the event type it was dispatched under
     * @param event the event instance
     */
    public record Received(String type, Event event) {}

    private final List<Received> received = new ArrayList<>();

    /** Binds a recording handler for each given type on the bus. */
    public RecordingEventHandler attachTo(EventBus bus, String... types) {
        for (String type : types) {
            bus.on(type, forType(type));
        }
        return this;
    }

    /** Binds a recording handler for every declared type of the bus. */
    public RecordingEventHandler attachToAll(EventBus bus) {
        return attachTo(bus, bus.fixedTypes().toArray(String[]::new));
    }

    /** Returns a handler that records events under the given type. */
    public EventHandler forType(String type) {
        return event -> received.add(new Received(type, event));
    }

    public List<Received> received() {
        return List.copyOf(received);
    }

    /** Returns the received event types in arrival order. */
    public List<String> types() {
        return received.stream().map(Received::type).collect(Collectors.toList());
    }

    /** Returns the events received under the given type. */
    public List<Event> ofType(String type) {
        return received.stream()
                .filter(r -> r.type().equals(type))
                .map(Received::event)
                .collect(Collectors.toList());
    }

    public int count(String type) {
        return ofType(type).size();
    }

    public void reset() {
        received.clear();
    }
}
