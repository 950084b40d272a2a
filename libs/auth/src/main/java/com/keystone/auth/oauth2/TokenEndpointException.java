package com.keystone.auth.oauth2;

/**
 * Non-successful response of an OAuth2 token endpoint.
 */
public class TokenEndpointException extends RuntimeException {

    private final int status;
    private final String errorDescription;
    private final String traceId;

    /**
     * @param status           HTTP status code
     * @param errorDescription {@code error_description} of the response, or its raw body
     * @param traceId          server-side trace id header, if any
     */
    public TokenEndpointException(int status, String errorDescription, String traceId) {
        super("Token endpoint responded with HTTP " + status + ": " + errorDescription);
        this.status = status;
        this.errorDescription = errorDescription;
        this.traceId = traceId;
    }

    public int status() {
        return status;
    }

    public String errorDescription() {
        return errorDescription;
    }

    public String traceId() {
        return traceId;
    }

    /** Returns true for the "JWT expired" rejection some servers send for an expired refresh token. */
    public boolean isExpiredRefreshToken() {
        return status == 400 && errorDescription != null && errorDescription.contains("JWT expired");
    }
}
