package com.keystone.auth.oauth2;

import com.keystone.observability.TraceContext;

/**
 * Performs the refresh-token grant against a token endpoint.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * @param authInfo     the config the session was issued for
     * @param refreshToken stored refresh token
     * @param scope        scopes to request again (nullable)
     * @throws TokenEndpointException if the endpoint answers with an error
     */
    TokenResponse refresh(OAuth2Authentication authInfo, String refreshToken, String scope, TraceContext trace);
}
