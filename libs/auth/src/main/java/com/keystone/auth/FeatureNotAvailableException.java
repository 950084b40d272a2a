package com.keystone.auth;

/**
 * Raised when an authenticator does not support an operation (refresh or revoke). Callers treat it
 * as a successful no-op.
 */
public class FeatureNotAvailableException extends RuntimeException {

    private final String feature;

    public FeatureNotAvailableException(String feature) {
        super("Feature not available: " + feature);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
