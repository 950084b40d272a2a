package com.keystone.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionStore} kept in process memory. Sessions are lost when the process exits.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, SessionInfo> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionInfo> load(String sessionId) {
        SessionInfo session = sessions.get(sessionId);
        log.debug("Session {}: {}", sessionId, session == null ? "not found" : "restored");
        return Optional.ofNullable(session);
    }

    @Override
    public void save(String sessionId, SessionInfo session) {
        sessions.put(sessionId, session);
        log.debug("Session {}: saved", sessionId);
    }

    @Override
    public void delete(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.debug("Session {}: removed", sessionId);
        }
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }
}
