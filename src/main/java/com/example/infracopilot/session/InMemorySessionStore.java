package com.example.infracopilot.session;

import com.example.infracopilot.config.CopilotProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Process-local session store backed by Caffeine. Sessions expire after the
 * configured idle time and the least recently used are evicted beyond the
 * session cap. Nothing survives a restart.
 */
@Slf4j
@Component
public class InMemorySessionStore implements SessionStore {

    private final Cache<String, Session> sessions;
    private final int maxTurns;
    private final Clock clock;

    @Autowired
    public InMemorySessionStore(CopilotProperties properties, Clock clock) {
        this(properties.getSessions(), clock, Ticker.systemTicker());
    }

    InMemorySessionStore(CopilotProperties.SessionConfig config, Clock clock, Ticker ticker) {
        this.maxTurns = Math.max(2, config.getMaxTurns());
        this.clock = clock;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(config.getIdleTimeoutMinutes()))
                .maximumSize(config.getMaxSessions())
                .ticker(ticker)
                .removalListener((String id, Session session, RemovalCause cause) ->
                        log.debug("Session {} removed ({})", id, cause))
                .build();
    }

    @Override
    public Session getOrCreate(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        Session session = sessions.get(id, this::newSession);
        session.touch(clock.instant());
        return session;
    }

    @Override
    public void append(String sessionId, ConversationTurn... turns) {
        Session session = sessions.get(sessionId, this::newSession);
        session.append(Arrays.asList(turns), clock.instant());
    }

    @Override
    public List<ConversationTurn> history(String sessionId) {
        Session session = sessions.getIfPresent(sessionId);
        return session != null ? session.getTurns() : List.of();
    }

    @Override
    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    @Override
    public boolean remove(String sessionId) {
        return sessions.asMap().remove(sessionId) != null;
    }

    @Override
    public Set<String> activeSessionIds() {
        sessions.cleanUp();
        return Set.copyOf(sessions.asMap().keySet());
    }

    private Session newSession(String id) {
        log.debug("Creating session {}", id);
        return new Session(id, maxTurns, clock.instant());
    }
}
