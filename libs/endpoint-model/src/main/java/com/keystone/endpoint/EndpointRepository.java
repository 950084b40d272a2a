package com.keystone.endpoint;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only view over a snapshot of endpoints, handed to callers after a context switch so they
 * can look up the endpoints they want to build clients for.
 */
public final class EndpointRepository {

    private final List<Endpoint> endpoints;

    public EndpointRepository(List<Endpoint> endpoints) {
        this.endpoints = List.copyOf(endpoints);
    }

    public List<Endpoint> all() {
        return endpoints;
    }

    public Optional<Endpoint> get(String id) {
        return endpoints.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    /** Returns endpoints of the given artifact, ignoring the version. */
    public List<Endpoint> ofArtifact(ServiceType type) {
        return endpoints.stream()
                .filter(e -> type.isSameArtifact(e.type()))
                .collect(Collectors.toList());
    }

    public int size() {
        return endpoints.size();
    }
}
