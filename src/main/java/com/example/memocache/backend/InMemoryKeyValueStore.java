package com.example.memocache.backend;

import com.example.memocache.core.CacheEntry;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-local stand-in for the remote store, with server-side TTL, simulated latency and an
 * outage switch. Used when no Redis is configured and by tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final class Stored {
        final String payload;
        final long expiresAt;

        Stored(String payload, long expiresAt) {
            this.payload = payload;
            this.expiresAt = expiresAt;
        }
    }

    private final ConcurrentHashMap<String, Stored> data = new ConcurrentHashMap<>();
    private final AtomicLong requestCount = new AtomicLong();
    private final Clock clock;
    private volatile long latencyMillis = 0;
    private volatile boolean unavailable = false;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletionStage<String> get(String key) {
        return respond(() -> {
            Stored stored = data.get(key);
            if (stored == null) {
                return null;
            }
            if (clock.millis() >= stored.expiresAt) {
                data.remove(key, stored);
                return null;
            }
            return stored.payload;
        });
    }

    @Override
    public CompletionStage<Void> setEx(String key, long ttlSeconds, String payload) {
        return respond(() -> {
            data.put(key, new Stored(payload, CacheEntry.expiryMillis(clock.millis(), ttlSeconds)));
            return null;
        });
    }

    @Override
    public CompletionStage<Boolean> delete(String key) {
        return respond(() -> data.remove(key) != null);
    }

    @Override
    public CompletionStage<Boolean> exists(String key) {
        return respond(() -> {
            Stored stored = data.get(key);
            return stored != null && clock.millis() < stored.expiresAt;
        });
    }

    @Override
    public CompletionStage<Long> deleteByPrefix(String prefix) {
        return respond(() -> {
            long removed = 0;
            for (String key : data.keySet()) {
                if (key.startsWith(prefix) && data.remove(key) != null) {
                    removed++;
                }
            }
            return removed;
        });
    }

    private <T> CompletionStage<T> respond(Supplier<T> operation) {
        requestCount.incrementAndGet();
        if (unavailable) {
            return CompletableFuture.failedFuture(new IllegalStateException("backend unavailable"));
        }
        if (latencyMillis <= 0) {
            return CompletableFuture.completedFuture(operation.get());
        }
        Executor delayed = CompletableFuture.delayedExecutor(latencyMillis, TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(operation, delayed);
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    /** When set, every request fails as if the server were unreachable. */
    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    public int size() {
        return data.size();
    }
}
