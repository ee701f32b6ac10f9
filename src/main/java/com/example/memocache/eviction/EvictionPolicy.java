package com.example.memocache.eviction;

import java.util.Locale;
import java.util.Optional;

/**
 * Chooses which key to drop when the local tier grows past its soft cap.
 *
 * <p>Implementations are not thread-safe: every call happens under the owning cache's lock.
 */
public interface EvictionPolicy {

    void onInsert(String key);

    void onHit(String key);

    void onRemove(String key);

    void clear();

    /** Picks and forgets the next victim; empty when no key is tracked. */
    Optional<String> selectVictim();

    static EvictionPolicy named(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "fifo":
                return new FifoEvictionPolicy();
            case "lru":
                return new LruEvictionPolicy();
            default:
                throw new IllegalArgumentException("Unknown eviction policy: " + name);
        }
    }
}
