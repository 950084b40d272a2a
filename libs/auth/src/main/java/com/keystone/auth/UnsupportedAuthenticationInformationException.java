package com.keystone.auth;

import java.util.Map;

/**
 * Raised when an authentication config names a scheme no authenticator implements.
 */
public class UnsupportedAuthenticationInformationException extends RuntimeException {

    private final String authType;

    public UnsupportedAuthenticationInformationException(String authType, Map<String, ?> authInfo) {
        super("Unsupported authentication type '" + authType + "' (keys: " + authInfo.keySet() + ")");
        this.authType = authType;
    }

    public String authType() {
        return authType;
    }
}
