package com.keystone.auth.oauth2;

import com.keystone.auth.Authenticator;
import com.keystone.auth.InvalidStateException;
import com.keystone.auth.NoRefreshTokenException;
import com.keystone.auth.ReauthenticationRequiredException;
import com.keystone.auth.SessionInfo;
import com.keystone.auth.SessionRestoration;
import com.keystone.auth.SessionStore;
import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.observability.TraceContext;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Authenticator} for OAuth2 configs.
 * <p>
 * The session is cached in this instance and persisted in a {@link SessionStore} under the
 * session id. A session issued for a different config (its {@code config_hash} differs from the
 * current session id) is treated as unusable. Login is delegated to the {@link OAuth2Adapter}
 * chosen by {@link OAuth2AdapterFactory}; refresh to a {@link TokenRefresher}.
 */
public class OAuth2Authenticator extends Authenticator {

    private final OAuth2Authentication authInfo;
    private final SessionStore sessionStore;
    private final OAuth2AdapterFactory adapterFactory;
    private final TokenRefresher tokenRefresher;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    private SessionInfo cachedSession;

    public OAuth2Authenticator(OAuth2Authentication authInfo,
                               SessionStore sessionStore,
                               OAuth2AdapterFactory adapterFactory,
                               TokenRefresher tokenRefresher,
                               Clock clock) {
        if (authInfo == null) {
            throw new IllegalArgumentException("authInfo must not be null");
        }
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore must not be null");
        }
        this.authInfo = authInfo;
        this.sessionStore = sessionStore;
        this.adapterFactory = adapterFactory == null ? new OAuth2AdapterFactory() : adapterFactory;
        this.tokenRefresher = tokenRefresher;
        this.redactor = new SensitiveDataRedactor();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public String sessionId() {
        return authInfo.contentHash();
    }

    @Override
    public Map<String, Object> authInfo() {
        return authInfo.toMap();
    }

    @Override
    public SessionRestoration restoreSession() {
        String sessionId = sessionId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cached", cachedSession != null);
        details.put("session_id", sessionId);

        SessionInfo session = cachedSession != null ? cachedSession : sessionStore.load(sessionId).orElse(null);
        log.debug("Session {}: restored {}", sessionId, session);

        SessionRestoration restoration;
        if (session == null) {
            restoration = SessionRestoration.authenticationRequired("No session available");
        } else if (session.isValid(clock.instant())) {
            if (sessionId.equals(session.configHash())) {
                return SessionRestoration.restored(session);
            }
            restoration = SessionRestoration.reauthenticationRequired(
                    "Authentication information has changed and the session is invalidated.");
        } else if (session.hasUsableRefreshToken()) {
            details.put("reason", "The session is invalid but it can be refreshed.");
            events().dispatch(SESSION_NOT_RESTORED, details);
            return SessionRestoration.refreshRequired(session);
        } else {
            restoration = SessionRestoration.reauthenticationRequired(
                    "The session is invalid and refreshing tokens is not possible.");
        }

        details.put("reason", restoration.reason());
        events().dispatch(SESSION_NOT_RESTORED, details);
        return restoration;
    }

    @Override
    public SessionInfo authenticate(TraceContext trace) {
        String sessionId = sessionId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", sessionId);
        details.put("auth_info", redactor.redact(authInfo()));

        events().dispatch(AUTHENTICATION_BEFORE, details);

        OAuth2Adapter adapter = adapterFactory.getFrom(authInfo).orElse(null);
        if (adapter == null) {
            details.put("reason", "No compatible OAuth2 adapter");
            events().dispatch(AUTHENTICATION_FAILURE, details);
            throw new OAuth2MisconfigurationException(
                    "Cannot determine the type of authentication (" + redactor.redact(authInfo()) + ")");
        }

        adapter.checkConfigReadiness();
        for (String eventType : OAuth2Adapter.EVENT_TYPES) {
            adapter.events().relay(events(), eventType);
        }

        TokenResponse response;
        try {
            response = adapter.exchangeTokens(trace);
        } catch (RuntimeException e) {
            details.put("reason", e.getMessage());
            events().dispatch(AUTHENTICATION_FAILURE, details);
            throw e;
        }

        SessionInfo session = toSession(authInfo, response, response.refreshToken());
        cachedSession = session;
        sessionStore.save(sessionId, session);

        details.put("session_info", session);
        events().dispatch(AUTHENTICATION_OK, details);
        log.debug("Session {}: authenticated via {}", sessionId, adapter.getClass().getSimpleName());
        return session;
    }

    @Override
    public SessionInfo refresh(TraceContext trace) {
        String sessionId = sessionId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cached", cachedSession != null);
        details.put("session_id", sessionId);

        events().dispatch(REFRESH_BEFORE, details);

        SessionInfo session = cachedSession != null ? cachedSession : sessionStore.load(sessionId).orElse(null);
        if (session == null) {
            throw new ReauthenticationRequiredException("No existing session information available");
        }
        if (session.modelVersion() < SessionInfo.MIN_REFRESHABLE_MODEL_VERSION) {
            details.put("reason", "Not enough information for token refresh");
            events().dispatch(REFRESH_FAILURE, details);
            throw new ReauthenticationRequiredException(
                    "The stored session information does not provide enough information to refresh token.");
        }
        if (!session.hasUsableRefreshToken()) {
            details.put("reason", "No refresh token");
            events().dispatch(REFRESH_FAILURE, details);
            throw new NoRefreshTokenException(sessionId);
        }
        if (tokenRefresher == null) {
            details.put("reason", "No token refresher configured");
            events().dispatch(REFRESH_FAILURE, details);
            throw new ReauthenticationRequiredException("Token refresh is not configured");
        }

        OAuth2Authentication sessionAuthInfo = session.handlerAuthInfo().isEmpty()
                ? authInfo
                : OAuth2Authentication.fromMap(session.handlerAuthInfo());

        TokenResponse response;
        try {
            response = tokenRefresher.refresh(sessionAuthInfo, session.refreshToken(), session.scope(), trace);
        } catch (TokenEndpointException e) {
            if (e.isExpiredRefreshToken()) {
                throw new ReauthenticationRequiredException("Refresh token expired");
            }
            details.put("reason", "Invalid state while refreshing tokens");
            events().dispatch(REFRESH_FAILURE, details);

            Map<String, Object> responseDetails = new LinkedHashMap<>();
            responseDetails.put("trace_id", e.traceId());
            responseDetails.put("status", e.status());
            Map<String, Object> exceptionDetails = new LinkedHashMap<>();
            exceptionDetails.put("request", Map.of("url", String.valueOf(sessionAuthInfo.tokenEndpoint())));
            exceptionDetails.put("response", responseDetails);
            exceptionDetails.put("reason", "Unable to refresh tokens: " + e.errorDescription());
            throw new InvalidStateException("Unable to refresh the access token", exceptionDetails);
        }

        String refreshToken = response.refreshToken() != null ? response.refreshToken() : session.refreshToken();
        SessionInfo refreshed = toSession(sessionAuthInfo, response, refreshToken);
        cachedSession = refreshed;
        sessionStore.save(sessionId, refreshed);

        details.put("session_info", refreshed);
        events().dispatch(REFRESH_OK, details);
        return refreshed;
    }

    @Override
    public void revoke() {
        String sessionId = sessionId();
        cachedSession = null;
        sessionStore.delete(sessionId);
        events().dispatch(SESSION_REVOKED, Map.of("session_id", sessionId));
    }

    private SessionInfo toSession(OAuth2Authentication issuedFor, TokenResponse response, String refreshToken) {
        long issuedAt = clock.instant().getEpochSecond();
        return new SessionInfo(
                SessionInfo.CURRENT_MODEL_VERSION,
                sessionId(),
                response.accessToken(),
                refreshToken,
                response.scope(),
                response.tokenType(),
                issuedAt,
                issuedAt + response.expiresIn(),
                issuedFor.toMap());
    }
}
