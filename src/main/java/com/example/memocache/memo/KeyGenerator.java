package com.example.memocache.memo;

/**
 * Derives the cache key of one call. Two calls are the same call iff their keys are equal, so an
 * implementation must be deterministic.
 */
@FunctionalInterface
public interface KeyGenerator {

    String generate(String functionId, Object... args);
}
