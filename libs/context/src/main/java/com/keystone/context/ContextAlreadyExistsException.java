package com.keystone.context;

/**
 * Thrown when a context name is already taken.
 */
public class ContextAlreadyExistsException extends RuntimeException {

    private final String contextName;

    public ContextAlreadyExistsException(String contextName) {
        super("The context, called \"" + contextName + "\", already exists.");
        this.contextName = contextName;
    }

    public String getContextName() {
        return contextName;
    }
}
