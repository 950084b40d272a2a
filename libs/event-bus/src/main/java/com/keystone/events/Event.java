package com.keystone.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single notification passed to every handler of one dispatch.
 *
 * <p>The details are copied on construction and cannot be modified afterwards. The only mutable
 * part is the propagation flag: a handler calls {@link #stopPropagation()} to prevent the handlers
 * registered after it from running for the same dispatch.
 */
public final class Event {

    private final Map<String, Object> details;
    private boolean propagated = true;

    private Event(Map<String, Object> details) {
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Creates an event carrying a copy of the given details.
     *
     * @param details event details (may be null, which yields an empty map)
     */
    public static Event of(Map<String, ?> details) {
        return new Event(details == null ? Map.of() : new LinkedHashMap<>(details));
    }

    /** Creates an event without details. */
    public static Event empty() {
        return new Event(Map.of());
    }

    public Map<String, Object> details() {
        return details;
    }

    /** Returns the detail stored under {@code key}, or null when absent. */
    public Object detail(String key) {
        return details.get(key);
    }

    /**
     * Returns the detail stored under {@code key} as the given type.
     *
     * @return the value, or null when absent
     * @throws ClassCastException if the value has another type
     */
    public <T> T detail(String key, Class<T> type) {
        return type.cast(details.get(key));
    }

    public boolean isPropagated() {
        return propagated;
    }

    /** Stops the remaining handlers of the current dispatch from receiving this event. */
    public void stopPropagation() {
        this.propagated = false;
    }

    @Override
    public String toString() {
        return "Event{details=" + details.keySet() + ", propagated=" + propagated + "}";
    }
}
