package com.example.memocache.core;

public class InvalidTtlException extends CacheException {

    private final long ttlSeconds;

    public InvalidTtlException(long ttlSeconds) {
        super("TTL must be positive, got " + ttlSeconds + "s");
        this.ttlSeconds = ttlSeconds;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public static long requirePositive(long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new InvalidTtlException(ttlSeconds);
        }
        return ttlSeconds;
    }
}
