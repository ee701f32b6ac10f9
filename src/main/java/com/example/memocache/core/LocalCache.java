package com.example.memocache.core;

import com.example.memocache.eviction.EvictionPolicy;
import com.example.memocache.eviction.FifoEvictionPolicy;
import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** In-process TTL cache (L1). One lock guards the map, the eviction policy and the counters. */
public class LocalCache implements TtlCache {

    private static final Logger log = LoggerFactory.getLogger(LocalCache.class);

    private final Map<String, CacheEntry<Object>> store = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;
    private final long defaultTtlSeconds;
    private final int maxEntries;

    // guarded by lock
    private long misses;
    private long evictions;
    private long expirations;

    public LocalCache(long defaultTtlSeconds) {
        this(defaultTtlSeconds, 0, new FifoEvictionPolicy(), Clock.systemUTC());
    }

    public LocalCache(long defaultTtlSeconds, int maxEntries, EvictionPolicy evictionPolicy, Clock clock) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0, got " + maxEntries);
        }
        this.defaultTtlSeconds = InvalidTtlException.requirePositive(defaultTtlSeconds);
        this.maxEntries = maxEntries;
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Object> get(String key) {
        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<Object> entry = store.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!entry.isLive(now)) {
                removeEntry(key);
                expirations++;
                misses++;
                log.debug("Expired entry dropped on read: key={}", key);
                return Optional.empty();
            }
            entry.recordHit(now);
            evictionPolicy.onHit(key);
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, Object value) {
        put(key, value, defaultTtlSeconds);
    }

    @Override
    public void put(String key, Object value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        InvalidTtlException.requirePositive(ttlSeconds);

        lock.lock();
        try {
            long now = clock.millis();
            store.put(key, new CacheEntry<>(value, now, ttlSeconds));
            evictionPolicy.onInsert(key);
            enforceCapacity(now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return removeEntry(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            store.clear();
            evictionPolicy.clear();
        } finally {
            lock.unlock();
        }
    }

    // returns the number of entries removed
    public int sweepExpired() {
        lock.lock();
        try {
            int removed = purgeExpired(clock.millis());
            expirations += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            long totalHits = 0;
            double ttlSum = 0;
            for (CacheEntry<Object> entry : store.values()) {
                totalHits += entry.getHitCount();
                ttlSum += entry.ttlSeconds;
            }
            int count = store.size();
            double averageTtl = count == 0 ? 0.0 : ttlSum / count;
            return new CacheStats(count, totalHits, averageTtl, misses, evictions, expirations, 0);
        } finally {
            lock.unlock();
        }
    }

    /** Entry under {@code key} without counting a hit or dropping it when dead. */
    public Optional<CacheEntry<Object>> inspect(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(store.get(key));
        } finally {
            lock.unlock();
        }
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    // dead entries go before any live one is evicted
    private void enforceCapacity(long now) {
        if (maxEntries == 0 || store.size() <= maxEntries) {
            return;
        }
        expirations += purgeExpired(now);
        while (store.size() > maxEntries) {
            Optional<String> victim = evictionPolicy.selectVictim();
            if (victim.isEmpty()) {
                break;
            }
            if (store.remove(victim.get()) != null) {
                evictions++;
                log.debug("Evicted entry over cap {}: key={}", maxEntries, victim.get());
            }
        }
    }

    private int purgeExpired(long now) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<Object>>> it = store.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry<Object>> e = it.next();
            if (!e.getValue().isLive(now)) {
                it.remove();
                evictionPolicy.onRemove(e.getKey());
                removed++;
            }
        }
        return removed;
    }

    private boolean removeEntry(String key) {
        if (store.remove(key) == null) {
            return false;
        }
        evictionPolicy.onRemove(key);
        return true;
    }
}
