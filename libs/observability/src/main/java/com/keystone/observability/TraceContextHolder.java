package com.keystone.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link TraceContext} with SLF4J MDC bridge.
 * <p>
 * While a context is set, every log statement on this thread carries its trace id, span id,
 * parent span id and origin. Clearing removes the MDC keys again.
 */
public final class TraceContextHolder {

    private static final ThreadLocal<TraceContext> CONTEXT = new ThreadLocal<>();

    private TraceContextHolder() {
        // utility class
    }

    /**
     * Sets the trace context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(TraceContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's trace context, if set. */
    public static Optional<TraceContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current context, or a new root for the given origin. */
    public static TraceContext currentOrRoot(String origin) {
        TraceContext current = CONTEXT.get();
        return current != null ? current : TraceContext.root(origin);
    }

    /** Clears the trace context and removes its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs the supplier with the given context set, then restores the previous context (or clears
     * it if there was none).
     */
    public static <T> T callWithContext(TraceContext context, Supplier<T> supplier) {
        TraceContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /** Void variant of {@link #callWithContext(TraceContext, Supplier)}. */
    public static void runWithContext(TraceContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    private static void populateMdc(TraceContext ctx) {
        setMdc(TraceContext.MDC_TRACE_ID, ctx.traceId());
        setMdc(TraceContext.MDC_SPAN_ID, ctx.spanId());
        setMdc(TraceContext.MDC_PARENT_SPAN_ID, ctx.parentSpanId());
        setMdc(TraceContext.MDC_ORIGIN, ctx.origin());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(TraceContext.MDC_TRACE_ID);
        MDC.remove(TraceContext.MDC_SPAN_ID);
        MDC.remove(TraceContext.MDC_PARENT_SPAN_ID);
        MDC.remove(TraceContext.MDC_ORIGIN);
    }
}
