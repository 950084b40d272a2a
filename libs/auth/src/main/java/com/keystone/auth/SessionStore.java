package com.keystone.auth;

import java.util.Optional;

/**
 * Storage of sessions keyed by session id.
 */
public interface SessionStore {

    Optional<SessionInfo> load(String sessionId);

    void save(String sessionId, SessionInfo session);

    /** Removes the session. Does nothing if none is stored. */
    void delete(String sessionId);
}
