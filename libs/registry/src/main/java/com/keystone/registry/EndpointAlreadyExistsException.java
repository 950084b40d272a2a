package com.keystone.registry;

import java.util.List;

/**
 * Thrown when a registry is added under an id or URL already present in the context.
 */
public class EndpointAlreadyExistsException extends RuntimeException {

    private final List<String> existingIds;

    public EndpointAlreadyExistsException(String message, List<String> existingIds) {
        super(message);
        this.existingIds = List.copyOf(existingIds);
    }

    /** Ids of the endpoints that conflict with the requested one. */
    public List<String> getExistingIds() {
        return existingIds;
    }
}
