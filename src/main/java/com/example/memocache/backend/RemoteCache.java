package com.example.memocache.backend;

import com.example.memocache.core.BackendUnavailableException;
import com.example.memocache.core.CacheStats;
import com.example.memocache.core.TtlCache;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The remote tier on its own behind the {@link TtlCache} contract: outages read as misses and
 * writes are dropped. Entry count is {@link CacheStats#UNKNOWN}; hits and misses are counted on
 * this side of the wire.
 */
public class RemoteCache implements TtlCache {

    private final RemoteCacheClient client;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public RemoteCache(RemoteCacheClient client) {
        this.client = client;
    }

    @Override
    public Optional<Object> get(String key) {
        Optional<Object> value;
        try {
            value = client.get(key);
        } catch (BackendUnavailableException e) {
            failures.incrementAndGet();
            value = Optional.empty();
        }
        (value.isPresent() ? hits : misses).incrementAndGet();
        return value;
    }

    @Override
    public void put(String key, Object value) {
        put(key, value, client.getDefaultTtlSeconds());
    }

    @Override
    public void put(String key, Object value, long ttlSeconds) {
        try {
            client.put(key, value, ttlSeconds);
        } catch (BackendUnavailableException e) {
            failures.incrementAndGet();
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return client.delete(key);
        } catch (BackendUnavailableException e) {
            failures.incrementAndGet();
            return false;
        }
    }

    @Override
    public void clear() {
        try {
            client.clear();
        } catch (BackendUnavailableException e) {
            failures.incrementAndGet();
        }
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
            CacheStats.UNKNOWN,
            hits.get(),
            client.getDefaultTtlSeconds(),
            misses.get(),
            0,
            0,
            failures.get());
    }
}
