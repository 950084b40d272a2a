package com.keystone.registry;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a synchronization does to one endpoint.
 */
public enum SyncAction {
    ADD("add"),
    UPDATE("update"),
    KEEP("keep"),
    REMOVE("remove");

    private final String wireValue;

    SyncAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** True for the actions that leave the endpoint in the catalog. */
    public boolean retains() {
        return this != REMOVE;
    }
}
