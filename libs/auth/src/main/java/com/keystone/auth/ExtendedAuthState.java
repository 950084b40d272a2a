package com.keystone.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * {@link AuthState} plus the ids of every catalog endpoint served by the session, in catalog order.
 */
public record ExtendedAuthState(
        @JsonProperty("authenticator") String authenticator,
        @JsonProperty("id") String id,
        @JsonProperty("auth_info") Map<String, Object> authInfo,
        @JsonProperty("session_info") SessionInfo sessionInfo,
        @JsonProperty("status") AuthStatus status,
        @JsonProperty("endpoints") List<String> endpoints) {

    public ExtendedAuthState {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }

    public static ExtendedAuthState of(AuthState state, List<String> endpoints) {
        return new ExtendedAuthState(state.authenticator(), state.id(), state.authInfo(),
                state.sessionInfo(), state.status(), endpoints);
    }
}
