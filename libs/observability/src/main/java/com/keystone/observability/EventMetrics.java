package com.keystone.observability;

import com.keystone.events.EventBus;
import com.keystone.events.EventHandler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Micrometer counters fed by {@link EventBus} notifications.
 * <p>
 * Every counter carries a {@code client} tag. {@link #countEvents} binds a handler that increments
 * a counter per dispatch, tagged with the event type and with one detail of the event (for
 * instance the {@code result} of a revocation or the {@code action} of a registry sync).
 */
public final class EventMetrics {

    /** Tag key for the client name. */
    public static final String TAG_CLIENT = "client";

    /** Tag key for the event type. */
    public static final String TAG_EVENT = "event";

    /** Tag value used when the tagged detail is absent. */
    public static final String NONE = "none";

    private final MeterRegistry registry;
    private final String clientName;

    /**
     * @param registry   the Micrometer meter registry
     * @param clientName logical client name included as a default tag
     */
    public EventMetrics(MeterRegistry registry, String clientName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("clientName must not be null or blank");
        }
        this.registry = registry;
        this.clientName = clientName;
    }

    /**
     * Creates (or looks up) a counter with the client tag.
     *
     * @param name        metric name (e.g. "keystone.auth.sessions")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Counts every {@code eventType} dispatch on the bus.
     *
     * @param bus        the bus to observe
     * @param eventType  the event type to count
     * @param metricName counter name
     * @param detailKey  event detail used as an extra tag (its key is the tag key), or null
     * @return the handler bound on the bus, so callers can unbind it
     */
    public EventHandler countEvents(EventBus bus, String eventType, String metricName, String detailKey) {
        EventHandler handler = event -> {
            if (detailKey == null) {
                counter(metricName, "Count of " + eventType + " events", TAG_EVENT, eventType).increment();
                return;
            }
            Object detail = event.details().get(detailKey);
            counter(metricName, "Count of " + eventType + " events",
                    TAG_EVENT, eventType,
                    detailKey, detail == null ? NONE : detail.toString()).increment();
        };
        bus.on(eventType, handler);
        return handler;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String clientName() {
        return clientName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_CLIENT, clientName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
