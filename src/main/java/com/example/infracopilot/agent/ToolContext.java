package com.example.infracopilot.agent;

import com.example.infracopilot.domain.ReportContext;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-turn execution context shared by the tools of one request.
 *
 * {@link #shared(String, Supplier)} memoizes intermediate results so that
 * concurrent tools needing the same input, such as the report tool and the
 * health tool, compute it once.
 */
@Getter
public class ToolContext {

    public static final String HEALTH = "health";
    public static final String METRICS = "metrics";

    private final String sessionId;
    private final ReportContext.Framing framing;
    private final Map<String, CompletableFuture<Object>> results = new ConcurrentHashMap<>();

    public ToolContext(String sessionId, ReportContext.Framing framing) {
        this.sessionId = sessionId;
        this.framing = framing;
    }

    /**
     * Returns the value for {@code key}, computing it on the calling thread if
     * no other tool has claimed it yet, or waiting for the claimant otherwise.
     * A failure of the claimant is rethrown to every waiter.
     */
    @SuppressWarnings("unchecked")
    public <T> T shared(String key, Supplier<T> supplier) {
        CompletableFuture<Object> claim = new CompletableFuture<>();
        CompletableFuture<Object> existing = results.putIfAbsent(key, claim);
        if (existing != null) {
            return (T) existing.join();
        }
        try {
            T value = supplier.get();
            claim.complete(value);
            return value;
        } catch (RuntimeException e) {
            claim.completeExceptionally(e);
            throw e;
        }
    }
}
