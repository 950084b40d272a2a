package com.keystone.auth;

/**
 * What a bulk authentication pass did for one session.
 *
 * @param sessionId session id
 * @param result    action taken
 */
public record AuthenticationOutcome(String sessionId, Result result) {

    public enum Result {
        /** A session was restored, refreshed or established by {@code initialize}. */
        AUTHENTICATED("authenticated"),
        /** The session was already READY; nothing changed. */
        UNCHANGED("unchanged"),
        /** A forced refresh ran (or the scheme has no refresh concept). */
        REFRESHED("refreshed"),
        /** A forced refresh was requested but there was no session to refresh. */
        REFRESH_SKIPPED("refresh-skipped"),
        /** The user interrupted the interaction. */
        SKIPPED("skipped");

        private final String wireValue;

        Result(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }
}
