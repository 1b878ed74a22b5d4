package com.example.infracopilot.session;

import com.example.infracopilot.config.CopilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final AtomicLong nanos = new AtomicLong();
    private CopilotProperties.SessionConfig config;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        config = new CopilotProperties.SessionConfig();
        config.setIdleTimeoutMinutes(60);
        config.setMaxTurns(6);
        config.setMaxSessions(100);
        store = new InMemorySessionStore(config, Clock.fixed(NOW, ZoneOffset.UTC), nanos::get);
    }

    private static ConversationTurn user(String text) {
        return ConversationTurn.user(text, NOW);
    }

    private static ConversationTurn agent(String text) {
        return ConversationTurn.agent(text, List.of(), null, NOW);
    }

    @Test
    void blankIdAllocatesFreshSession() {
        Session first = store.getOrCreate(null);
        Session second = store.getOrCreate("  ");

        assertNotNull(first.getId());
        assertNotEquals(first.getId(), second.getId());
        assertEquals(first.getId(), store.getOrCreate(first.getId()).getId());
    }

    @Test
    void unknownSessionHasEmptyHistory() {
        assertTrue(store.history("nobody").isEmpty());
        assertTrue(store.find("nobody").isEmpty());
    }

    @Test
    void historyIsBoundedOldestFirst() {
        String id = store.getOrCreate("s-1").getId();
        for (int i = 1; i <= 5; i++) {
            store.append(id, user("q" + i), agent("a" + i));
        }

        List<ConversationTurn> history = store.history(id);

        assertEquals(6, history.size());
        assertEquals("q3", history.get(0).getText());
        assertEquals("a5", history.get(5).getText());
    }

    @Test
    void oddCapNeverLeavesAgentTurnAtHead() {
        config.setMaxTurns(5);
        store = new InMemorySessionStore(config, Clock.fixed(NOW, ZoneOffset.UTC), nanos::get);
        String id = store.getOrCreate("s-odd").getId();
        for (int i = 1; i <= 4; i++) {
            store.append(id, user("q" + i), agent("a" + i));
        }

        List<ConversationTurn> history = store.history(id);

        assertEquals(4, history.size());
        assertEquals(ConversationTurn.Role.USER, history.get(0).getRole());
        assertEquals("q3", history.get(0).getText());
        assertEquals("a4", history.get(3).getText());
    }

    @Test
    void idleSessionExpires() {
        String id = store.getOrCreate("s-1").getId();
        store.append(id, user("q"), agent("a"));

        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertEquals(2, store.history(id).size());

        nanos.addAndGet(Duration.ofMinutes(61).toNanos());
        assertTrue(store.history(id).isEmpty());
        assertFalse(store.activeSessionIds().contains(id));
    }

    @Test
    void removeReportsWhetherSessionExisted() {
        store.getOrCreate("s-1");

        assertTrue(store.remove("s-1"));
        assertFalse(store.remove("s-1"));
    }

    @Test
    void concurrentAppendsKeepPairsTogether() throws Exception {
        config.setMaxTurns(1000);
        store = new InMemorySessionStore(config, Clock.fixed(NOW, ZoneOffset.UTC), nanos::get);
        String id = store.getOrCreate("shared").getId();

        int writers = 8;
        int pairsPerWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < pairsPerWriter; i++) {
                    store.append(id, user(writer + ":" + i), agent(writer + ":" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        List<ConversationTurn> history = store.history(id);
        assertEquals(writers * pairsPerWriter * 2, history.size());
        for (int i = 0; i < history.size(); i += 2) {
            assertEquals(ConversationTurn.Role.USER, history.get(i).getRole());
            assertEquals(ConversationTurn.Role.AGENT, history.get(i + 1).getRole());
            assertEquals(history.get(i).getText(), history.get(i + 1).getText());
        }
    }
}
