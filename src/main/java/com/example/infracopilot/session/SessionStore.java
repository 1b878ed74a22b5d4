package com.example.infracopilot.session;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed conversation history with bounded retention.
 *
 * Appends to the same session are serialized; sessions with different ids
 * proceed independently.
 */
public interface SessionStore {

    /**
     * Returns the session for {@code sessionId}, creating it when absent.
     * A null or blank id allocates a fresh opaque id.
     */
    Session getOrCreate(String sessionId);

    /**
     * Appends the given turns as one unit: no concurrent append to the same
     * session can interleave with them. Creates the session if it expired.
     */
    void append(String sessionId, ConversationTurn... turns);

    /** Turns oldest first; empty when the session is unknown or expired. */
    List<ConversationTurn> history(String sessionId);

    Optional<Session> find(String sessionId);

    boolean remove(String sessionId);

    Set<String> activeSessionIds();
}
