package com.keystone.registry;

/**
 * Thrown when a URL or hostname does not lead to a service registry.
 */
public class InvalidServiceRegistryException extends RuntimeException {

    private final String target;

    public InvalidServiceRegistryException(String target, String message) {
        super(message);
        this.target = target;
    }

    public InvalidServiceRegistryException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    /** The hostname or URL that was checked. */
    public String getTarget() {
        return target;
    }
}
