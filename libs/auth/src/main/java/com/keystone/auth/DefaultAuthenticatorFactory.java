package com.keystone.auth;

import com.keystone.auth.oauth2.OAuth2AdapterFactory;
import com.keystone.auth.oauth2.OAuth2Authentication;
import com.keystone.auth.oauth2.OAuth2Authenticator;
import com.keystone.auth.oauth2.TokenRefresher;
import com.keystone.endpoint.Endpoint;

import java.time.Clock;
import java.util.Map;

/**
 * {@link AuthenticatorFactory} for the {@code oauth2} scheme, the only one supported.
 */
public class DefaultAuthenticatorFactory implements AuthenticatorFactory {

    private final SessionStore sessionStore;
    private final OAuth2AdapterFactory adapterFactory;
    private final TokenRefresher tokenRefresher;
    private final Clock clock;

    public DefaultAuthenticatorFactory(SessionStore sessionStore,
                                       OAuth2AdapterFactory adapterFactory,
                                       TokenRefresher tokenRefresher,
                                       Clock clock) {
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore must not be null");
        }
        this.sessionStore = sessionStore;
        this.adapterFactory = adapterFactory;
        this.tokenRefresher = tokenRefresher;
        this.clock = clock;
    }

    @Override
    public Authenticator create(Map<String, Object> authInfo) {
        Object type = authInfo.get(Endpoint.AUTH_TYPE_KEY);
        String authType = type == null || type.toString().isBlank() ? Endpoint.DEFAULT_AUTH_TYPE : type.toString();
        if (!OAuth2Authentication.TYPE.equals(authType)) {
            throw new UnsupportedAuthenticationInformationException(authType, authInfo);
        }
        return new OAuth2Authenticator(OAuth2Authentication.fromMap(authInfo), sessionStore, adapterFactory,
                tokenRefresher, clock);
    }
}
