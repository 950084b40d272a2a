package com.keystone.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper}: span creation, trace context attributes and error recording.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        Tracer tracer = otelSdk.getTracer("test-tracer");
        spanHelper = new SpanHelper(tracer);
    }

    @AfterEach
    void cleanup() {
        TraceContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("noop() helper runs the work without recording")
    void noopRunsWork() {
        assertThat(SpanHelper.noop().withSpan("op", Map.of(), () -> 42)).isEqualTo(42);
    }

    @Nested
    @DisplayName("withSpan")
    class WithSpan {

        @Test
        @DisplayName("should create a span with attributes and return the result")
        void shouldCreateSpan() {
            String result = spanHelper.withSpan("auth.initialize", Map.of("session.id", "abc"), () -> "ok");

            assertThat(result).isEqualTo("ok");
            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getName()).isEqualTo("auth.initialize");
            assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
            assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey("session.id")))
                    .isEqualTo("abc");
        }

        @Test
        @DisplayName("should record error on exception and re-throw")
        void shouldRecordError() {
            assertThatThrownBy(() -> spanHelper.withSpan("failing", Map.of(), () -> {
                throw new IllegalStateException("test error");
            })).isInstanceOf(IllegalStateException.class).hasMessage("test error");

            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(spans.get(0).getEvents()).isNotEmpty();
        }

        @Test
        @DisplayName("should attach the current trace context")
        void shouldAttachTraceContext() {
            var ctx = new TraceContext("trace-1", "span-1", null, "SessionManager");
            TraceContextHolder.set(ctx);

            spanHelper.withSpan("traced", Map.of(), () -> "ok");

            var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
            assertThat(attributes.get(AttributeKey.stringKey("keystone.trace.id"))).isEqualTo("trace-1");
            assertThat(attributes.get(AttributeKey.stringKey("keystone.origin"))).isEqualTo("SessionManager");
        }
    }

    @Test
    @DisplayName("runInSpan creates a span for void work")
    void runInSpan() {
        spanHelper.runInSpan("void-op", Map.of(), () -> { });

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("void-op");
    }
}
