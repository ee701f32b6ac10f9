package com.example.memocache.core;

import java.util.Optional;

/**
 * Key/value cache whose entries expire after a time-to-live.
 *
 * <p>Implementations never report a backend outage through this contract: a tier that cannot be
 * reached reads as a miss and drops writes. The only failures a caller sees are misuse errors
 * ({@link InvalidTtlException}, {@link CacheSerializationException}).
 */
public interface TtlCache {

    Optional<Object> get(String key);

    /** Stores {@code value} with the cache's configured default TTL. */
    void put(String key, Object value);

    /**
     * Stores {@code value}, fully replacing any previous entry under {@code key}.
     *
     * @throws InvalidTtlException if {@code ttlSeconds <= 0}
     */
    void put(String key, Object value, long ttlSeconds);

    /** @return true if a locally known entry was removed */
    boolean delete(String key);

    void clear();

    CacheStats stats();
}
