package com.keystone.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Event")
class EventTest {

    @Test
    @DisplayName("copies details so later changes to the source map are invisible")
    void copiesDetails() {
        Map<String, Object> source = new HashMap<>();
        source.put("url", "https://example.org/verify");

        Event event = Event.of(source);
        source.put("url", "changed");

        assertThat(event.detail("url", String.class)).isEqualTo("https://example.org/verify");
    }

    @Test
    @DisplayName("details are read-only")
    void detailsReadOnly() {
        Event event = Event.of(Map.of("a", 1));
        assertThatThrownBy(() -> event.details().put("b", 2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("null details produce an empty, propagated event")
    void nullDetails() {
        Event event = Event.of(null);
        assertThat(event.details()).isEmpty();
        assertThat(event.isPropagated()).isTrue();
    }
}
