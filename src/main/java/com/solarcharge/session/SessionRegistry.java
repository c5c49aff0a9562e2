package com.solarcharge.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local map from {@link SessionKey} to the id of the session believed ACTIVE on
 * that port. A cache only: the store decides whether a session is active.
 */
public class SessionRegistry {

    private final ConcurrentMap<SessionKey, String> sessions = new ConcurrentHashMap<>();

    /** @return the session id previously tracked for the key, if any */
    public Optional<String> track(SessionKey key, String sessionId) {
        return Optional.ofNullable(sessions.put(key, sessionId));
    }

    public Optional<String> sessionFor(SessionKey key) {
        return Optional.ofNullable(sessions.get(key));
    }

    public Optional<SessionKey> keyOf(String sessionId) {
        return sessions.entrySet().stream()
                .filter(e -> e.getValue().equals(sessionId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public boolean release(SessionKey key) {
        return sessions.remove(key) != null;
    }

    /** Removes the entry only if it still maps to {@code sessionId}. */
    public boolean release(SessionKey key, String sessionId) {
        return sessions.remove(key, sessionId);
    }

    public int size() {
        return sessions.size();
    }

    public Map<SessionKey, String> snapshot() {
        return Map.copyOf(sessions);
    }

    public void clear() {
        sessions.clear();
    }
}
