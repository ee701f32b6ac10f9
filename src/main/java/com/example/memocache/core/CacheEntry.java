package com.example.memocache.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Value unit held by {@link LocalCache}. The payload and its timestamps never change after
 * insertion; only the read bookkeeping (hit count, last access) moves.
 */
public class CacheEntry<V> {

    public final V value;
    public final long createdAt;   // epoch millis
    public final long expiresAt;   // absolute timestamp in millis when TTL expires
    public final long ttlSeconds;

    private final AtomicLong hitCount = new AtomicLong();
    private volatile long lastAccessedAt;

    public CacheEntry(V value, long createdAt, long ttlSeconds) {
        this.value = value;
        this.createdAt = createdAt;
        this.ttlSeconds = ttlSeconds;
        this.expiresAt = expiryMillis(createdAt, ttlSeconds);
        this.lastAccessedAt = createdAt;
    }

    /** {@code createdAt + ttlSeconds} in millis, saturating at {@code Long.MAX_VALUE}. */
    public static long expiryMillis(long createdAt, long ttlSeconds) {
        if (ttlSeconds > (Long.MAX_VALUE - createdAt) / 1000L) {
            return Long.MAX_VALUE;
        }
        return createdAt + ttlSeconds * 1000L;
    }

    public boolean isLive(long now) {
        return now < expiresAt;
    }

    void recordHit(long now) {
        hitCount.incrementAndGet();
        lastAccessedAt = now;
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }
}
