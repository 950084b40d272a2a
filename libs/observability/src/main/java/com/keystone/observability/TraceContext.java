package com.keystone.observability;

import java.util.UUID;

/**
 * Immutable trace handle passed through credential and registry operations.
 * <p>
 * A root context is created once per caller-visible operation (an authentication pass, a
 * revocation, a registry sync). Nested steps derive a child, which keeps the trace id and records
 * its parent span. The values are copied into SLF4J MDC by {@link TraceContextHolder}.
 *
 * @param traceId      identifier shared by every span of one operation
 * @param spanId       identifier of this step
 * @param parentSpanId span id of the enclosing step (null for a root)
 * @param origin       name of the component that opened this step
 */
public record TraceContext(
        String traceId,
        String spanId,
        String parentSpanId,
        String origin
) {

    /** MDC key for the trace id. */
    public static final String MDC_TRACE_ID = "traceId";

    /** MDC key for the span id. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for the parent span id. */
    public static final String MDC_PARENT_SPAN_ID = "parentSpanId";

    /** MDC key for the origin. */
    public static final String MDC_ORIGIN = "origin";

    public TraceContext {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be null or blank");
        }
        if (spanId == null || spanId.isBlank()) {
            throw new IllegalArgumentException("spanId must not be null or blank");
        }
    }

    /**
     * Opens a new trace.
     *
     * @param origin name of the component starting the operation
     */
    public static TraceContext root(String origin) {
        return new TraceContext(newId(), newId(), null, origin);
    }

    /**
     * Derives a nested step of this trace.
     *
     * @param childOrigin name of the nested step
     */
    public TraceContext child(String childOrigin) {
        return new TraceContext(traceId, newId(), spanId, childOrigin);
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
