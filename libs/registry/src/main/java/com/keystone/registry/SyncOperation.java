package com.keystone.registry;

import com.keystone.endpoint.Endpoint;

/**
 * @param action   classification of the endpoint
 * @param endpoint the resolved endpoint (the new value for add and update)
 */
public record SyncOperation(SyncAction action, Endpoint endpoint) {

    public SyncOperation {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint must not be null");
        }
    }
}
