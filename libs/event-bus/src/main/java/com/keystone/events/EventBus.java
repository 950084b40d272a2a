package com.keystone.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process, synchronous publish/subscribe primitive.
 *
 * <p>A bus created with declared event types runs in fixed-type mode and rejects any other type
 * with {@link UnknownEventTypeException}. A bus created without declared types accepts any type.
 *
 * <p>Handlers run on the dispatching thread, in registration order, and all receive the same
 * {@link Event} instance. There is no queueing and no isolation between handlers.
 *
 * <p>This class is not thread-safe.
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final String alias;
    private final Set<String> fixedTypes;
    private final Map<String, HandlerList> handlers = new LinkedHashMap<>();

    /**
     * Creates a bus in dynamic mode.
     *
     * @param owner name of the owning component, used in log output
     */
    public EventBus(String owner) {
        this(owner, List.of());
    }

    /**
     * Creates a bus restricted to the given event types. An empty list means dynamic mode.
     *
     * @param owner      name of the owning component, used in log output
     * @param fixedTypes declared event type names
     */
    public EventBus(String owner, List<String> fixedTypes) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be null or blank");
        }
        this.alias = owner + "/" + Integer.toHexString(System.identityHashCode(this));
        this.fixedTypes = new LinkedHashSet<>(fixedTypes == null ? List.of() : fixedTypes);
        log.debug("{}: initialized with fixed types {}", alias, this.fixedTypes);
    }

    /** Returns the declared event types (empty in dynamic mode). */
    public List<String> fixedTypes() {
        return List.copyOf(fixedTypes);
    }

    /** Declares additional event types. */
    public void addFixedTypes(String... types) {
        Collections.addAll(fixedTypes, types);
    }

    /** Returns true when this bus only accepts declared event types. */
    public boolean isFixed() {
        return !fixedTypes.isEmpty();
    }

    /**
     * Binds a handler to an event type. Binding the same handler instance twice is ignored.
     *
     * @return this bus
     * @throws UnknownEventTypeException if the bus is fixed and the type is not declared
     */
    public EventBus on(String eventType, EventHandler handler) {
        requireKnown(eventType);
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        HandlerList list = handlers.computeIfAbsent(eventType, k -> new HandlerList());
        if (list.add(handler)) {
            log.debug("{}: E/{}: BIND {}", alias, eventType, handler);
        } else {
            log.debug("{}: E/{}: IGNORE BINDING {} (duplicate)", alias, eventType, handler);
        }
        return this;
    }

    /**
     * Unbinds a handler instance. Does nothing when the handler is not bound.
     *
     * @return this bus
     * @throws UnknownEventTypeException if the bus is fixed and the type is not declared
     */
    public EventBus off(String eventType, EventHandler handler) {
        requireKnown(eventType);
        HandlerList list = handlers.get(eventType);
        if (list != null && list.remove(handler)) {
            log.debug("{}: E/{}: UNBIND {}", alias, eventType, handler);
        }
        return this;
    }

    /**
     * Dispatches an event built from the given details.
     *
     * @see #dispatch(String, Event)
     */
    public void dispatch(String eventType, Map<String, ?> details) {
        dispatch(eventType, Event.of(details));
    }

    /**
     * Invokes every handler bound to {@code eventType}, in registration order, until one of them
     * stops propagation. Handler exceptions propagate to the caller and abort the dispatch.
     *
     * @throws UnknownEventTypeException if the bus is fixed and the type is not declared
     */
    public void dispatch(String eventType, Event event) {
        requireKnown(eventType);
        Event actual = event == null ? Event.empty() : event;
        HandlerList list = handlers.get(eventType);

        log.debug("{}: E/{}: DISPATCH BEGIN", alias, eventType);
        if (list != null) {
            for (EventHandler handler : list.snapshot()) {
                if (!actual.isPropagated()) {
                    break;
                }
                handler.handle(actual);
            }
        }
        log.debug("{}: E/{}: DISPATCH END", alias, eventType);
    }

    /**
     * Forwards every {@code eventType} event of this bus to {@code target} under the same type.
     *
     * @return the relay handler bound on this bus
     */
    public EventRelay relay(EventBus target, String eventType) {
        EventRelay relay = new EventRelay(target, eventType);
        log.debug("{}: SET RELAY ON {} => {}", alias, eventType, target);
        on(eventType, relay);
        return relay;
    }

    /** Relays every declared event type of {@code origin} into this bus. */
    public void passthrough(EventBus origin) {
        for (String eventType : origin.fixedTypes()) {
            origin.relay(this, eventType);
        }
    }

    /** Returns the number of handlers bound to the given type. */
    public int handlerCount(String eventType) {
        HandlerList list = handlers.get(eventType);
        return list == null ? 0 : list.size();
    }

    /** Removes all handlers of the given type. */
    public void clear(String eventType) {
        HandlerList list = handlers.get(eventType);
        if (list != null) {
            list.clear();
        }
    }

    /** Removes every handler. Called when the owning component is disposed. */
    public void clear() {
        handlers.clear();
    }

    private void requireKnown(String eventType) {
        if (!fixedTypes.isEmpty() && !fixedTypes.contains(eventType)) {
            log.error("{}: unknown event type {}; the declared types are {}", alias, eventType, fixedTypes);
            throw new UnknownEventTypeException(eventType, List.copyOf(fixedTypes));
        }
    }

    @Override
    public String toString() {
        return alias;
    }

    /** Ordered handlers plus an identity set for duplicate suppression. */
    private static final class HandlerList {

        private final List<EventHandler> ordered = new ArrayList<>();
        private final Set<EventHandler> identities = Collections.newSetFromMap(new IdentityHashMap<>());

        boolean add(EventHandler handler) {
            if (!identities.add(handler)) {
                return false;
            }
            ordered.add(handler);
            return true;
        }

        boolean remove(EventHandler handler) {
            if (!identities.remove(handler)) {
                return false;
            }
            ordered.removeIf(existing -> existing == handler);
            return true;
        }

        List<EventHandler> snapshot() {
            return List.copyOf(ordered);
        }

        int size() {
            return ordered.size();
        }

        void clear() {
            ordered.clear();
            identities.clear();
        }
    }
}
