package com.keystone.context;

/**
 * Thrown when a named context does not exist.
 */
public class ContextNotFoundException extends RuntimeException {

    private final String contextName;

    public ContextNotFoundException(String contextName) {
        super("The context, called \"" + contextName + "\", does not exist.");
        this.contextName = contextName;
    }

    public String getContextName() {
        return contextName;
    }
}
