package com.keystone.auth;

/**
 * Raised when the user aborts an interactive step (a verification prompt or a confirmation).
 * Bulk authentication stops at the current session and reports it as skipped.
 */
public class InteractionInterruptedException extends RuntimeException {

    public InteractionInterruptedException(String message) {
        super(message);
    }

    public InteractionInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
