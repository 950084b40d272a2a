package com.keystone.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TraceContextHolder} and {@link TraceContext}: ThreadLocal storage, MDC bridge,
 * child derivation and scoped execution.
 */
@DisplayName("TraceContextHolder")
class TraceContextHolderTest {

    @AfterEach
    void cleanup() {
        TraceContextHolder.clear();
    }

    @Nested
    @DisplayName("TraceContext")
    class Context {

        @Test
        @DisplayName("child keeps the trace id and links to the parent span")
        void childLinksParent() {
            TraceContext root = TraceContext.root("SessionManager");
            TraceContext child = root.child("OAuth2Authenticator");

            assertThat(child.traceId()).isEqualTo(root.traceId());
            assertThat(child.parentSpanId()).isEqualTo(root.spanId());
            assertThat(child.spanId()).isNotEqualTo(root.spanId());
            assertThat(child.origin()).isEqualTo("OAuth2Authenticator");
        }

        @Test
        @DisplayName("rejects blank trace id")
        void rejectsBlankTraceId() {
            assertThatThrownBy(() -> new TraceContext(" ", "span", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("traceId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates and clears MDC keys")
        void populatesAndClears() {
            TraceContextHolder.set(new TraceContext("trace-1", "span-1", null, "origin-1"));

            assertThat(MDC.get("traceId")).isEqualTo("trace-1");
            assertThat(MDC.get("spanId")).isEqualTo("span-1");
            assertThat(MDC.get("parentSpanId")).isNull();
            assertThat(MDC.get("origin")).isEqualTo("origin-1");

            TraceContextHolder.clear();

            assertThat(MDC.get("traceId")).isNull();
            assertThat(TraceContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> TraceContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class Scoped {

        @Test
        @DisplayName("restores the previous context afterwards")
        void restoresPrevious() {
            var outer = new TraceContext("outer", "s1", null, null);
            var inner = outer.child("inner");
            TraceContextHolder.set(outer);
            AtomicReference<TraceContext> seen = new AtomicReference<>();

            TraceContextHolder.runWithContext(inner, () -> seen.set(TraceContextHolder.get().orElseThrow()));

            assertThat(seen.get()).isEqualTo(inner);
            assertThat(TraceContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("clears when there was no previous context, even on exception")
        void clearsOnException() {
            assertThatThrownBy(() -> TraceContextHolder.callWithContext(TraceContext.root("x"), () -> {
                throw new IllegalStateException("fail");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(TraceContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("currentOrRoot opens a root when nothing is set")
        void currentOrRoot() {
            TraceContext ctx = TraceContextHolder.currentOrRoot("RegistrySynchronizer");
            assertThat(ctx.origin()).isEqualTo("RegistrySynchronizer");
            assertThat(ctx.parentSpanId()).isNull();
        }
    }
}
