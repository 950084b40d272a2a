package com.keystone.endpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A named catalog of endpoints.
 * <p>
 * The endpoint list is ordered and owned exclusively by this context. {@link #defaults()} maps a
 * short client type (e.g. "data_connect") to the id of the endpoint used when none is named.
 * <p>
 * Mutable; not thread-safe.
 */
public final class Context {

    private final String guid;
    private final List<Endpoint> endpoints;
    private final Map<String, String> defaults;

    public Context() {
        this(UUID.randomUUID().toString(), List.of(), Map.of());
    }

    @JsonCreator
    public Context(@JsonProperty("guid") String guid,
                   @JsonProperty("endpoints") List<Endpoint> endpoints,
                   @JsonProperty("defaults") Map<String, String> defaults) {
        this.guid = guid == null ? UUID.randomUUID().toString() : guid;
        this.endpoints = new ArrayList<>(endpoints == null ? List.of() : endpoints);
        this.defaults = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    }

    @JsonProperty("guid")
    public String guid() {
        return guid;
    }

    /** The live, mutable endpoint list. */
    @JsonProperty("endpoints")
    public List<Endpoint> endpoints() {
        return endpoints;
    }

    /** The live, mutable short-type-to-endpoint-id map. */
    @JsonProperty("defaults")
    public Map<String, String> defaults() {
        return defaults;
    }

    public Optional<Endpoint> findEndpoint(String id) {
        return endpoints.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    /** Replaces the endpoint list with the given endpoints. */
    public void replaceEndpoints(List<Endpoint> replacement) {
        List<Endpoint> copy = List.copyOf(replacement);
        endpoints.clear();
        endpoints.addAll(copy);
    }

    /** Returns an independent copy (same guid). */
    @JsonIgnore
    public Context copy() {
        return new Context(guid, endpoints, defaults);
    }

    @Override
    public String toString() {
        return "Context{guid=" + guid + ", endpoints=" + endpoints.size() + ", defaults=" + defaults + "}";
    }
}
