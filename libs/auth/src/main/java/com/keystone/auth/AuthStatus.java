package com.keystone.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Observable status of an {@link Authenticator}.
 */
public enum AuthStatus {

    /** Nothing stored yet. */
    UNINITIALIZED("uninitialized"),

    /** A valid session for the current configuration exists. */
    READY("ready"),

    /** The stored session expired but carries a refresh token. */
    REFRESH_REQUIRED("refresh-required"),

    /** The stored session cannot be used and a new login is needed. */
    REAUTH_REQUIRED("reauth-required");

    private final String wireValue;

    AuthStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves a status from its wire value.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static AuthStatus fromWireValue(String value) {
        for (AuthStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown auth status: " + value);
    }
}
