package com.keystone.auth;

import com.keystone.endpoint.Context;
import com.keystone.endpoint.CredentialFingerprint;
import com.keystone.endpoint.Endpoint;
import com.keystone.events.Event;
import com.keystone.events.EventBus;
import com.keystone.events.EventHandler;
import com.keystone.observability.SpanHelper;
import com.keystone.observability.TraceContext;
import com.keystone.observability.TraceContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Drives bulk authentication, state reporting and revocation over the endpoints of a catalog.
 * <p>
 * Endpoints are resolved to one {@link Authenticator} per distinct credential fingerprint, so N
 * endpoints sharing a config lead to one login. Equal fingerprints resolve to the same cached
 * instance for as long as some catalog endpoint uses that fingerprint. Entries no endpoint uses
 * are released, and their handlers unbound, on the next call that reads the catalog.
 * <p>
 * Bulk loops are sequential. Exceptions abort the remaining sessions, except an
 * {@link InteractionInterruptedException}, which ends the loop after reporting the current
 * session as skipped.
 */
public class SessionManager {

    public static final String AUTH_BEGIN = "auth-begin";
    public static final String AUTH_END = "auth-end";
    public static final String NO_REFRESH_TOKEN = "no-refresh-token";
    public static final String REFRESH_SKIPPED = "refresh-skipped";
    public static final String REVOKE_BEGIN = "revoke-begin";
    public static final String REVOKE_END = "revoke-end";
    public static final String USER_VERIFICATION_REQUIRED = "user-verification-required";
    public static final String USER_VERIFICATION_OK = "user-verification-ok";
    public static final String USER_VERIFICATION_FAILED = "user-verification-failed";

    public static final List<String> EVENT_TYPES = List.of(
            AUTH_BEGIN, AUTH_END, NO_REFRESH_TOKEN, REFRESH_SKIPPED,
            REVOKE_BEGIN, REVOKE_END,
            USER_VERIFICATION_REQUIRED, USER_VERIFICATION_OK, USER_VERIFICATION_FAILED);

    public static final String RESULT_REMOVED = "removed";
    public static final String RESULT_ABORTED = "aborted";
    public static final String RESULT_ALREADY_REMOVED = "already removed";

    static final String MDC_SESSION_ID = "sessionId";
    static final String REQUESTED_SUFFIX = " (requested)";

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Supplier<List<Endpoint>> endpointSource;
    private final AuthenticatorFactory factory;
    private final SpanHelper spans;
    private final EventBus events = new EventBus("SessionManager", EVENT_TYPES);
    private final Map<String, Authenticator> authenticators = new LinkedHashMap<>();

    private final EventHandler blockingResponseRequiredHandler = this::handleBlockingResponseRequired;
    private final EventHandler blockingResponseOkHandler =
            event -> forwardUserVerification(event, USER_VERIFICATION_OK);
    private final EventHandler blockingResponseFailedHandler =
            event -> forwardUserVerification(event, USER_VERIFICATION_FAILED);

    /**
     * @param endpointSource supplies the current catalog on every call
     * @param factory        creates authenticators for unseen fingerprints
     * @param spans          span helper for per-session spans
     */
    public SessionManager(Supplier<List<Endpoint>> endpointSource, AuthenticatorFactory factory, SpanHelper spans) {
        if (endpointSource == null) {
            throw new IllegalArgumentException("endpointSource must not be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.endpointSource = endpointSource;
        this.factory = factory;
        this.spans = spans == null ? SpanHelper.noop() : spans;
    }

    /** Creates a manager over the live endpoint list of a context. */
    public static SessionManager forContext(Context context, AuthenticatorFactory factory) {
        return new SessionManager(context::endpoints, factory, SpanHelper.noop());
    }

    public EventBus events() {
        return events;
    }

    /**
     * Returns the distinct authenticators serving the given endpoints (all endpoints when the
     * collection is null or empty).
     */
    public List<Authenticator> getAuthenticators(Collection<String> endpointIds) {
        return bindings(endpointSource.get(), endpointIds).stream()
                .map(Binding::authenticator)
                .collect(Collectors.toList());
    }

    /** Returns the states of every session of the catalog. */
    public Iterable<ExtendedAuthState> getStates() {
        return getStates(null);
    }

    /**
     * Returns one state per distinct authenticator serving the given endpoints. The sequence is
     * computed lazily and every iteration reads the catalog and the sessions again.
     * <p>
     * {@link ExtendedAuthState#endpoints()} lists every catalog endpoint whose config has the
     * session's fingerprint, including endpoints outside the requested ids.
     */
    public Iterable<ExtendedAuthState> getStates(Collection<String> endpointIds) {
        return () -> {
            List<Endpoint> catalog = endpointSource.get();
            Iterator<Binding> bindings = bindings(catalog, endpointIds).iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return bindings.hasNext();
                }

                @Override
                public ExtendedAuthState next() {
                    return extendedState(bindings.next(), catalog);
                }
            };
        };
    }

    /**
     * Brings every session serving the given endpoints to READY.
     *
     * @param endpointIds    endpoint ids (all when null or empty)
     * @param forceRefresh   refresh READY and REFRESH_REQUIRED sessions instead of authenticating
     * @param revokeExisting revoke a non-READY session before initializing it again
     * @return one outcome per processed session, in processing order
     */
    public List<AuthenticationOutcome> initiateAuthentications(Collection<String> endpointIds,
                                                               boolean forceRefresh,
                                                               boolean revokeExisting) {
        TraceContext trace = TraceContextHolder.currentOrRoot("SessionManager").child("initiateAuthentications");
        List<Binding> bindings = bindings(endpointSource.get(), endpointIds);
        int total = bindings.size();
        List<AuthenticationOutcome> outcomes = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            Authenticator authenticator = bindings.get(i).authenticator();
            int index = i;
            try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION_ID, authenticator.sessionId())) {
                AuthenticationOutcome.Result result = TraceContextHolder.callWithContext(trace.child("session"),
                        () -> spans.withSpan("keystone.auth.initiate",
                                Map.of("keystone.session.id", authenticator.sessionId()),
                                () -> authenticateOne(authenticator, index, total, forceRefresh, revokeExisting, trace)));
                outcomes.add(new AuthenticationOutcome(authenticator.sessionId(), result));
            } catch (InteractionInterruptedException e) {
                log.warn("Session {}: interaction interrupted, skipping the remaining sessions", authenticator.sessionId());
                Map<String, Object> details = basicDetails(authenticator, null, index, total);
                details.put("result", AuthenticationOutcome.Result.SKIPPED.wireValue());
                events.dispatch(AUTH_END, details);
                outcomes.add(new AuthenticationOutcome(authenticator.sessionId(), AuthenticationOutcome.Result.SKIPPED));
                break;
            }
        }
        return outcomes;
    }

    /**
     * Revokes every session serving the given endpoints.
     *
     * @param endpointIds  endpoint ids (all when null or empty)
     * @param confirmation asked before each revocation of a working session; null means no prompt
     * @return ids of every endpoint whose session was removed, including endpoints sharing the
     *         session with a requested one
     */
    public List<String> revoke(Collection<String> endpointIds, BooleanSupplier confirmation) {
        List<Endpoint> catalog = endpointSource.get();
        List<Binding> bindings = bindings(catalog, endpointIds);
        Set<String> requested = endpointIds == null ? Set.of() : Set.copyOf(endpointIds);
        int total = bindings.size();
        List<String> affected = new ArrayList<>();

        for (int i = 0; i < total; i++) {
            Binding binding = bindings.get(i);
            Authenticator authenticator = binding.authenticator();
            ExtendedAuthState state = extendedState(binding, catalog);

            Map<String, Object> details = basicDetails(authenticator, state, i, total);
            details.put("endpoint_ids", state.endpoints().stream()
                    .map(id -> requested.contains(id) ? id + REQUESTED_SUFFIX : id)
                    .collect(Collectors.toList()));
            details.put("scopes", grantedScopes(state.sessionInfo()));

            events.dispatch(REVOKE_BEGIN, details);

            if (state.status() == AuthStatus.UNINITIALIZED) {
                events.dispatch(REVOKE_END, withResult(details, RESULT_ALREADY_REMOVED));
                continue;
            }

            if (state.status() == AuthStatus.REAUTH_REQUIRED || confirmation == null || confirmation.getAsBoolean()) {
                spans.runInSpan("keystone.auth.revoke", Map.of("keystone.session.id", authenticator.sessionId()),
                        () -> revokeQuietly(authenticator));
                events.dispatch(REVOKE_END, withResult(details, RESULT_REMOVED));
                affected.addAll(state.endpoints());
            } else {
                events.dispatch(REVOKE_END, withResult(details, RESULT_ABORTED));
            }
        }
        return affected;
    }

    /**
     * Handles an authenticator's {@code blocking-response-required} event. A
     * {@code user_verification} request is passed up as {@code user-verification-required} with
     * its URL. Other kinds are logged and dropped.
     */
    public void handleBlockingResponseRequired(Event event) {
        if (Authenticator.KIND_USER_VERIFICATION.equals(event.details().get("kind"))) {
            log.debug("Intercepted blocking-response-required for user verification ({})", event.details());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("url", event.details().get("url"));
            events.dispatch(USER_VERIFICATION_REQUIRED, details);
        } else {
            log.error("Intercepted blocking-response-required but FAILED to handle {}", event.details());
        }
    }

    /** Unbinds this manager from every cached authenticator and clears its bus. */
    public void dispose() {
        for (Authenticator authenticator : authenticators.values()) {
            unbind(authenticator);
        }
        authenticators.clear();
        events.clear();
    }

    private AuthenticationOutcome.Result authenticateOne(Authenticator authenticator, int index, int total,
                                                         boolean forceRefresh, boolean revokeExisting,
                                                         TraceContext trace) {
        AuthState state = authenticator.getState();
        Map<String, Object> details = basicDetails(authenticator, state, index, total);
        events.dispatch(AUTH_BEGIN, details);

        if (forceRefresh) {
            if (state.status() != AuthStatus.READY && state.status() != AuthStatus.REFRESH_REQUIRED) {
                events.dispatch(REFRESH_SKIPPED, details);
                return AuthenticationOutcome.Result.REFRESH_SKIPPED;
            }
            try {
                authenticator.refresh(trace);
            } catch (FeatureNotAvailableException e) {
                log.debug("Session {}: refresh not available", authenticator.sessionId());
            } catch (NoRefreshTokenException e) {
                log.info("Session {}: no refresh token, keeping the current session", authenticator.sessionId());
                events.dispatch(NO_REFRESH_TOKEN, details);
                events.dispatch(AUTH_END, withResult(details, AuthenticationOutcome.Result.UNCHANGED.wireValue()));
                return AuthenticationOutcome.Result.UNCHANGED;
            } catch (ReauthenticationRequiredException e) {
                log.info("Session {}: refresh rejected ({}), initializing again",
                        authenticator.sessionId(), e.getMessage());
                return initializeSession(authenticator, state, details, trace);
            }
            events.dispatch(AUTH_END, withResult(details, AuthenticationOutcome.Result.REFRESHED.wireValue()));
            return AuthenticationOutcome.Result.REFRESHED;
        }

        if (state.status() == AuthStatus.READY) {
            events.dispatch(AUTH_END, withResult(details, AuthenticationOutcome.Result.UNCHANGED.wireValue()));
            return AuthenticationOutcome.Result.UNCHANGED;
        }

        if (revokeExisting) {
            revokeQuietly(authenticator);
        }
        return initializeSession(authenticator, state, details, trace);
    }

    private AuthenticationOutcome.Result initializeSession(Authenticator authenticator, AuthState state,
                                                           Map<String, Object> details, TraceContext trace) {
        SessionInfo session = authenticator.initialize(trace);
        details.put("state", new AuthState(state.authenticator(), state.id(), state.authInfo(), session,
                AuthStatus.READY));

        if (!session.hasUsableRefreshToken()) {
            events.dispatch(NO_REFRESH_TOKEN, details);
        }
        events.dispatch(AUTH_END, withResult(details, AuthenticationOutcome.Result.AUTHENTICATED.wireValue()));
        return AuthenticationOutcome.Result.AUTHENTICATED;
    }

    private void revokeQuietly(Authenticator authenticator) {
        try {
            authenticator.revoke();
        } catch (FeatureNotAvailableException e) {
            log.debug("Session {}: revoke not available", authenticator.sessionId());
        }
    }

    private void forwardUserVerification(Event event, String eventType) {
        if (Authenticator.KIND_USER_VERIFICATION.equals(event.details().get("kind"))) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("url", event.details().get("url"));
            events.dispatch(eventType, details);
        }
    }

    private List<Binding> bindings(List<Endpoint> catalog, Collection<String> endpointIds) {
        pruneUnused(catalog);
        List<Binding> bindings = new ArrayList<>();
        for (Map<String, Object> authInfo : AuthenticatorFactory.uniqueAuthInfo(filter(catalog, endpointIds))) {
            String fingerprint = CredentialFingerprint.of(authInfo);
            Authenticator authenticator = authenticators.get(fingerprint);
            if (authenticator == null) {
                authenticator = factory.create(authInfo);
                authenticator.events()
                        .on(Authenticator.BLOCKING_RESPONSE_REQUIRED, blockingResponseRequiredHandler)
                        .on(Authenticator.BLOCKING_RESPONSE_OK, blockingResponseOkHandler)
                        .on(Authenticator.BLOCKING_RESPONSE_FAILED, blockingResponseFailedHandler);
                authenticators.put(fingerprint, authenticator);
                log.debug("Created {} for fingerprint {}", authenticator, fingerprint);
            }
            bindings.add(new Binding(fingerprint, authenticator));
        }
        return bindings;
    }

    /** Drops cached authenticators whose fingerprint no catalog endpoint uses any more. */
    private void pruneUnused(List<Endpoint> catalog) {
        Set<String> inUse = new HashSet<>();
        for (Endpoint endpoint : catalog) {
            for (Map<String, Object> authInfo : endpoint.authentications()) {
                inUse.add(CredentialFingerprint.of(authInfo));
            }
        }
        Iterator<Map.Entry<String, Authenticator>> cached = authenticators.entrySet().iterator();
        while (cached.hasNext()) {
            Map.Entry<String, Authenticator> entry = cached.next();
            if (!inUse.contains(entry.getKey())) {
                unbind(entry.getValue());
                cached.remove();
                log.debug("Released {} for fingerprint {}", entry.getValue(), entry.getKey());
            }
        }
    }

    private void unbind(Authenticator authenticator) {
        authenticator.events()
                .off(Authenticator.BLOCKING_RESPONSE_REQUIRED, blockingResponseRequiredHandler)
                .off(Authenticator.BLOCKING_RESPONSE_OK, blockingResponseOkHandler)
                .off(Authenticator.BLOCKING_RESPONSE_FAILED, blockingResponseFailedHandler);
    }

    private static ExtendedAuthState extendedState(Binding binding, List<Endpoint> catalog) {
        AuthState state = binding.authenticator().getState();
        List<String> endpointIds = new ArrayList<>();
        for (Endpoint endpoint : catalog) {
            boolean matches = endpoint.authentications().stream()
                    .anyMatch(authInfo -> CredentialFingerprint.of(authInfo).equals(binding.fingerprint()));
            if (matches) {
                endpointIds.add(endpoint.id());
            }
        }
        return ExtendedAuthState.of(state, endpointIds);
    }

    private static List<Endpoint> filter(List<Endpoint> endpoints, Collection<String> endpointIds) {
        if (endpointIds == null || endpointIds.isEmpty()) {
            return List.copyOf(endpoints);
        }
        return endpoints.stream()
                .filter(endpoint -> endpointIds.contains(endpoint.id()))
                .collect(Collectors.toList());
    }

    private static List<String> grantedScopes(SessionInfo session) {
        if (session == null || session.scope() == null || session.scope().isBlank()) {
            return List.of();
        }
        return Arrays.stream(session.scope().trim().split("\\s+")).sorted().collect(Collectors.toList());
    }

    private static Map<String, Object> basicDetails(Authenticator authenticator, Object state, int index, int total) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", authenticator.sessionId());
        details.put("state", state);
        details.put("index", index);
        details.put("total", total);
        return details;
    }

    private static Map<String, Object> withResult(Map<String, Object> details, String result) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put("result", result);
        return copy;
    }

    private record Binding(String fingerprint, Authenticator authenticator) {}
}
