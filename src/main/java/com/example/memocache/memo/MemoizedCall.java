package com.example.memocache.memo;

import com.example.memocache.core.CacheStats;
import com.example.memocache.core.InvalidTtlException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * State shared by the memoized wrapper types: the function's identity, its TTL and how its keys
 * are derived.
 */
public abstract class MemoizedCall<R> {

    private final Memoizer memoizer;
    private final String functionId;
    private final long ttlSeconds;
    private final KeyGenerator keyGenerator;

    protected MemoizedCall(Memoizer memoizer, String functionId, long ttlSeconds, KeyGenerator keyGenerator) {
        this.memoizer = Objects.requireNonNull(memoizer, "memoizer");
        this.functionId = Objects.requireNonNull(functionId, "functionId");
        this.ttlSeconds = InvalidTtlException.requirePositive(ttlSeconds);
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
    }

    protected R invoke(Object[] args, Supplier<R> target) {
        return memoizer.lookupOrLoad(keyFor(args), ttlSeconds, target);
    }

    protected String keyFor(Object[] args) {
        return keyGenerator.generate(functionId, args);
    }

    protected void invalidateKey(Object[] args) {
        memoizer.getCache().delete(keyFor(args));
    }

    /** Drops everything in the underlying cache, not only this function's entries. */
    public void invalidate() {
        memoizer.getCache().clear();
    }

    public CacheStats statistics() {
        return memoizer.getCache().stats();
    }

    public String getFunctionId() {
        return functionId;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }
}
