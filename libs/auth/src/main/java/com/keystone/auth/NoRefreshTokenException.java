package com.keystone.auth;

/**
 * Raised by {@link Authenticator#refresh} when the stored session has no refresh token.
 */
public class NoRefreshTokenException extends RuntimeException {

    private final String sessionId;

    public NoRefreshTokenException(String sessionId) {
        super("No refresh token for session " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
