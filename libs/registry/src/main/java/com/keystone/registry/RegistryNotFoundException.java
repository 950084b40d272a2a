package com.keystone.registry;

/**
 * Thrown when no registry endpoint with the given id exists in the context.
 */
public class RegistryNotFoundException extends RuntimeException {

    private final String registryId;

    public RegistryNotFoundException(String registryId) {
        super("Registry not found: " + registryId);
        this.registryId = registryId;
    }

    public String getRegistryId() {
        return registryId;
    }
}
