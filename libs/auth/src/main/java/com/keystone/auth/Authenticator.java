package com.keystone.auth;

import com.keystone.events.EventBus;
import com.keystone.observability.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * One credential-scheme state machine, identified by a session id derived from the fingerprint of
 * its authentication config.
 * <p>
 * Subclasses implement the individual steps. {@link #initialize(TraceContext)} composes them:
 * <pre>
 * RESTORED                                  -&gt; session
 * AUTHENTICATION_REQUIRED / REAUTH_REQUIRED -&gt; authenticate()
 * REFRESH_REQUIRED                          -&gt; refresh(), falling back to authenticate()
 * </pre>
 * After {@code initialize} the authenticator is READY or an exception was thrown.
 * <p>
 * Progress is reported on {@link #events()}, a fixed-type bus declaring the constants below.
 */
public abstract class Authenticator {

    public static final String AUTHENTICATION_BEFORE = "authentication-before";
    public static final String AUTHENTICATION_OK = "authentication-ok";
    public static final String AUTHENTICATION_FAILURE = "authentication-failure";
    public static final String BLOCKING_RESPONSE_REQUIRED = "blocking-response-required";
    public static final String BLOCKING_RESPONSE_OK = "blocking-response-ok";
    public static final String BLOCKING_RESPONSE_FAILED = "blocking-response-failed";
    public static final String INITIALIZATION_BEFORE = "initialization-before";
    public static final String REFRESH_BEFORE = "refresh-before";
    public static final String REFRESH_OK = "refresh-ok";
    public static final String REFRESH_FAILURE = "refresh-failure";
    public static final String SESSION_RESTORED = "session-restored";
    public static final String SESSION_NOT_RESTORED = "session-not-restored";
    public static final String SESSION_REVOKED = "session-revoked";

    /** {@code kind} of a blocking-response request asking the user to open a verification URL. */
    public static final String KIND_USER_VERIFICATION = "user_verification";

    /** Every event type an authenticator may dispatch. */
    public static final List<String> EVENT_TYPES = List.of(
            AUTHENTICATION_BEFORE, AUTHENTICATION_OK, AUTHENTICATION_FAILURE,
            BLOCKING_RESPONSE_REQUIRED, BLOCKING_RESPONSE_OK, BLOCKING_RESPONSE_FAILED,
            INITIALIZATION_BEFORE,
            REFRESH_BEFORE, REFRESH_OK, REFRESH_FAILURE,
            SESSION_RESTORED, SESSION_NOT_RESTORED, SESSION_REVOKED);

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final EventBus events;

    protected Authenticator() {
        String owner = getClass().getSimpleName();
        this.events = new EventBus(owner.isEmpty() ? getClass().getName() : owner, EVENT_TYPES);
    }

    public EventBus events() {
        return events;
    }

    /** Session id: fingerprint of the authentication config. */
    public abstract String sessionId();

    /** The parsed authentication config, without null-valued entries. */
    public abstract Map<String, Object> authInfo();

    /**
     * Loads the stored session without any network or user interaction.
     */
    public abstract SessionRestoration restoreSession();

    /**
     * Performs a full login. May dispatch {@link #BLOCKING_RESPONSE_REQUIRED} and wait for the
     * handler to return.
     */
    public abstract SessionInfo authenticate(TraceContext trace);

    /**
     * Exchanges the stored refresh token for a new session.
     *
     * @throws NoRefreshTokenException            if no refresh token is stored
     * @throws ReauthenticationRequiredException  if the session cannot be refreshed
     * @throws FeatureNotAvailableException       if the scheme has no refresh concept
     * @throws InvalidStateException              if the token endpoint fails unexpectedly
     */
    public abstract SessionInfo refresh(TraceContext trace);

    /**
     * Clears the stored session.
     *
     * @throws FeatureNotAvailableException if the scheme cannot revoke
     */
    public abstract void revoke();

    /**
     * Reports the current status. Does not change the stored session.
     */
    public AuthState getState() {
        SessionRestoration restoration = restoreSession();
        return new AuthState(getClass().getName(), sessionId(), authInfo(), restoration.session(),
                restoration.status());
    }

    /**
     * Restores, refreshes or establishes a session, whichever the stored state calls for.
     *
     * @return a usable session
     */
    public SessionInfo initialize(TraceContext trace) {
        events.dispatch(INITIALIZATION_BEFORE, Map.of("origin", getClass().getSimpleName()));
        log.debug("initialize: restoring session {}", sessionId());

        SessionRestoration restoration = restoreSession();
        switch (restoration.outcome()) {
            case RESTORED -> {
                events.dispatch(SESSION_RESTORED, Map.of("session_id", sessionId()));
                log.debug("initialize: restored session {}", sessionId());
                return restoration.session();
            }
            case AUTHENTICATION_REQUIRED, REAUTHENTICATION_REQUIRED -> {
                log.debug("initialize: {}, authenticating", restoration.reason());
                return authenticate(trace);
            }
            case REFRESH_REQUIRED -> {
                log.debug("initialize: refreshing session {}", sessionId());
                try {
                    return refresh(trace);
                } catch (ReauthenticationRequiredException | NoRefreshTokenException e) {
                    log.debug("initialize: refresh failed ({}), authenticating", e.getMessage());
                    return authenticate(trace);
                }
            }
            default -> throw new IllegalStateException("Unhandled restoration outcome: " + restoration.outcome());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "/" + sessionId().substring(0, Math.min(8, sessionId().length()));
    }
}
