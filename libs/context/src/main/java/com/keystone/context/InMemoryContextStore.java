package com.keystone.context;

import com.keystone.endpoint.Context;
import com.keystone.endpoint.ContextMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ContextStore} kept in memory. Not thread-safe.
 */
public class InMemoryContextStore implements ContextStore {

    private final Map<String, Context> contexts = new LinkedHashMap<>();
    private String currentContextName;

    public InMemoryContextStore() {
    }

    public InMemoryContextStore(Map<String, Context> initial) {
        contexts.putAll(initial);
    }

    @Override
    public Optional<Context> load(String name) {
        return Optional.ofNullable(contexts.get(name));
    }

    @Override
    public void save(String name, Context context) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        contexts.put(name, Objects.requireNonNull(context, "context"));
    }

    @Override
    public void unset(String name) {
        if (contexts.remove(name) == null) {
            throw new ContextNotFoundException(name);
        }
        if (name.equals(currentContextName)) {
            currentContextName = null;
        }
    }

    @Override
    public void rename(String oldName, String newName) {
        if (!contexts.containsKey(oldName)) {
            throw new ContextNotFoundException(oldName);
        }
        if (contexts.containsKey(newName)) {
            throw new ContextAlreadyExistsException(newName);
        }
        contexts.put(newName, contexts.remove(oldName));
        if (oldName.equals(currentContextName)) {
            currentContextName = newName;
        }
    }

    @Override
    public List<ContextMetadata> list() {
        return contexts.keySet().stream()
                .map(name -> new ContextMetadata(name, name.equals(currentContextName)))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> currentContextName() {
        return Optional.ofNullable(currentContextName);
    }

    @Override
    public void setCurrentContextName(String name) {
        this.currentContextName = name;
    }
}
