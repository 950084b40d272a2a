package com.keystone.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link TraceContext}.
 * <p>
 * The SDK (exporter, sampler) is configured by the embedding application. {@link #noop()} gives a
 * helper that records nothing.
 */
public final class SpanHelper {

    /** Instrumentation scope name used by {@link #noop()}. */
    public static final String INSTRUMENTATION_NAME = "com.keystone";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Returns a helper backed by the no-op OpenTelemetry implementation. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs the supplier inside a new internal span.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param supplier   the work to run
     * @return the supplier's result
     */
    public <T> T withSpan(String spanName, Map<String, String> attributes, Supplier<T> supplier) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();

        TraceContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("keystone.trace.id", ctx.traceId());
            if (ctx.origin() != null) {
                span.setAttribute("keystone.origin", ctx.origin());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = supplier.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #withSpan(String, Map, Supplier)}. */
    public void runInSpan(String spanName, Map<String, String> attributes, Runnable runnable) {
        withSpan(spanName, attributes, () -> {
            runnable.run();
            return null;
        });
    }

    /** Returns the underlying tracer. */
    public Tracer tracer() {
        return tracer;
    }
}
