package com.keystone.auth.oauth2;

/**
 * Raised when an OAuth2 config matches no adapter or lacks fields the adapter needs.
 */
public class OAuth2MisconfigurationException extends RuntimeException {

    public OAuth2MisconfigurationException(String message) {
        super(message);
    }

    public OAuth2MisconfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
