package com.keystone.context;

import com.keystone.endpoint.Context;
import com.keystone.endpoint.ContextMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryContextStore")
class InMemoryContextStoreTest {

    private InMemoryContextStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        store.save("one", new Context());
        store.save("two", new Context());
        store.setCurrentContextName("one");
    }

    @Test
    @DisplayName("lists contexts in insertion order and flags the current one")
    void list() {
        assertThat(store.list()).containsExactly(
                new ContextMetadata("one", true),
                new ContextMetadata("two", false));
    }

    @Test
    @DisplayName("moves the current name along with a rename")
    void renameCurrent() {
        Context context = store.load("one").orElseThrow();

        store.rename("one", "first");

        assertThat(store.currentContextName()).contains("first");
        assertThat(store.currentContext()).contains(context);
        assertThat(store.load("one")).isEmpty();
    }

    @Test
    @DisplayName("refuses to rename onto an existing name")
    void renameConflict() {
        assertThatThrownBy(() -> store.rename("one", "two")).isInstanceOf(ContextAlreadyExistsException.class);
    }

    @Test
    @DisplayName("clears the current name when the current context is removed")
    void unsetCurrent() {
        store.unset("one");

        assertThat(store.currentContextName()).isEmpty();
        assertThat(store.currentContext()).isEmpty();
    }
}
