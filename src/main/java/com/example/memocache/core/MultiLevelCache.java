package com.example.memocache.core;

import com.example.memocache.backend.RemoteCacheClient;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** L1 in front of L2. Remote outages are counted, never thrown. */
public class MultiLevelCache implements TtlCache {

    private static final Logger log = LoggerFactory.getLogger(MultiLevelCache.class);

    private final LocalCache local;
    private final RemoteCacheClient remote;
    private final AtomicLong remoteFailures = new AtomicLong();

    public MultiLevelCache(LocalCache local, RemoteCacheClient remote) {
        this.local = Objects.requireNonNull(local, "local");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    @Override
    public Optional<Object> get(String key) {
        Optional<Object> cached = local.get(key);
        if (cached.isPresent()) {
            log.debug("L1 hit: key={}", key);
            return cached;
        }

        Optional<Object> fromRemote;
        try {
            fromRemote = remote.get(key);
        } catch (BackendUnavailableException e) {
            remoteFailures.incrementAndGet();
            return Optional.empty();
        }

        fromRemote.ifPresent(value -> {
            local.put(key, value); // backfill with the local default TTL
            log.debug("L2 hit, backfilled L1: key={}", key);
        });
        return fromRemote;
    }

    // L2 failure does not undo the L1 write
    @Override
    public void put(String key, Object value) {
        local.put(key, value);
        try {
            remote.put(key, value);
        } catch (BackendUnavailableException e) {
            remoteFailures.incrementAndGet();
        }
    }

    @Override
    public void put(String key, Object value, long ttlSeconds) {
        local.put(key, value, ttlSeconds);
        try {
            remote.put(key, value, ttlSeconds);
        } catch (BackendUnavailableException e) {
            remoteFailures.incrementAndGet();
        }
    }

    @Override
    public boolean delete(String key) {
        boolean removed = local.delete(key);
        try {
            remote.delete(key);
        } catch (BackendUnavailableException e) {
            remoteFailures.incrementAndGet();
        }
        return removed;
    }

    @Override
    public void clear() {
        local.clear();
        try {
            long removed = remote.clear();
            log.info("Cleared both tiers: {} remote keys removed", removed);
        } catch (BackendUnavailableException e) {
            remoteFailures.incrementAndGet();
        }
    }

    @Override
    public CacheStats stats() {
        return local.stats().withBackendFailures(remoteFailures.get());
    }

    public LocalCache getLocal() {
        return local;
    }

    public RemoteCacheClient getRemote() {
        return remote;
    }
}
