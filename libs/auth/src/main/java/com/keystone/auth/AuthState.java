package com.keystone.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of an {@link Authenticator}.
 *
 * @param authenticator fully qualified class name of the authenticator
 * @param id            session id
 * @param authInfo      parsed authentication config
 * @param sessionInfo   current or prior session (null when none is stored)
 * @param status        current status
 */
public record AuthState(
        @JsonProperty("authenticator") String authenticator,
        @JsonProperty("id") String id,
        @JsonProperty("auth_info") Map<String, Object> authInfo,
        @JsonProperty("session_info") SessionInfo sessionInfo,
        @JsonProperty("status") AuthStatus status) {

    public AuthState {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        authInfo = authInfo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(authInfo));
    }
}
