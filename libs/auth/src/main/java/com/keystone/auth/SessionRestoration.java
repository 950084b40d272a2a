package com.keystone.auth;

/**
 * Result of {@link Authenticator#restoreSession()}.
 * <p>
 * {@code session} is set for {@link Outcome#RESTORED} (the usable session) and
 * {@link Outcome#REFRESH_REQUIRED} (the expired session to refresh). {@code reason} explains every
 * other outcome.
 */
public record SessionRestoration(Outcome outcome, SessionInfo session, String reason) {

    public enum Outcome {
        /** A valid session for the current config was found. */
        RESTORED,
        /** Nothing is stored. */
        AUTHENTICATION_REQUIRED,
        /** The stored session is unusable (config changed, or expired without refresh token). */
        REAUTHENTICATION_REQUIRED,
        /** The stored session expired and can be refreshed. */
        REFRESH_REQUIRED
    }

    public SessionRestoration {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if ((outcome == Outcome.RESTORED || outcome == Outcome.REFRESH_REQUIRED) && session == null) {
            throw new IllegalArgumentException("session must not be null for " + outcome);
        }
    }

    public static SessionRestoration restored(SessionInfo session) {
        return new SessionRestoration(Outcome.RESTORED, session, null);
    }

    public static SessionRestoration authenticationRequired(String reason) {
        return new SessionRestoration(Outcome.AUTHENTICATION_REQUIRED, null, reason);
    }

    public static SessionRestoration reauthenticationRequired(String reason) {
        return new SessionRestoration(Outcome.REAUTHENTICATION_REQUIRED, null, reason);
    }

    public static SessionRestoration refreshRequired(SessionInfo priorSession) {
        return new SessionRestoration(Outcome.REFRESH_REQUIRED, priorSession, "Session refresh required");
    }

    /** Maps the outcome to the status reported by {@link Authenticator#getState()}. */
    public AuthStatus status() {
        return switch (outcome) {
            case RESTORED -> AuthStatus.READY;
            case AUTHENTICATION_REQUIRED -> AuthStatus.UNINITIALIZED;
            case REAUTHENTICATION_REQUIRED -> AuthStatus.REAUTH_REQUIRED;
            case REFRESH_REQUIRED -> AuthStatus.REFRESH_REQUIRED;
        };
    }
}
