package com.example.infracopilot.session;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation state for one session id. Only the owning {@link SessionStore}
 * mutates it; every mutation and every history copy happens under the
 * session's own lock, so readers never observe a half-applied append.
 */
public class Session {

    private final String id;
    private final Instant createdAt;
    private final int maxTurns;
    private final Deque<ConversationTurn> turns = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Instant lastAccessedAt;

    Session(String id, int maxTurns, Instant createdAt) {
        this.id = id;
        this.maxTurns = maxTurns;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    /** Consistent copy of the turns, oldest first. */
    public List<ConversationTurn> getTurns() {
        lock.lock();
        try {
            return List.copyOf(turns);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return turns.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends all turns contiguously, then drops the oldest beyond the cap.
     * History never starts with an agent turn, so an odd cap keeps one turn less.
     */
    void append(List<ConversationTurn> newTurns, Instant now) {
        lock.lock();
        try {
            turns.addAll(newTurns);
            while (turns.size() > maxTurns) {
                turns.removeFirst();
            }
            while (!turns.isEmpty() && turns.peekFirst().getRole() == ConversationTurn.Role.AGENT) {
                turns.removeFirst();
            }
            lastAccessedAt = now;
        } finally {
            lock.unlock();
        }
    }

    void touch(Instant now) {
        lastAccessedAt = now;
    }
}
