package com.example.memocache.memo;

import java.util.function.Supplier;

public class MemoizedSupplier<R> extends MemoizedCall<R> implements Supplier<R> {

    private static final Object[] NO_ARGS = new Object[0];

    private final Supplier<R> target;

    MemoizedSupplier(Memoizer memoizer, String functionId, long ttlSeconds, KeyGenerator keys, Supplier<R> target) {
        super(memoizer, functionId, ttlSeconds, keys);
        this.target = target;
    }

    @Override
    public R get() {
        return invoke(NO_ARGS, target);
    }

    /** Drops the cached result so the next {@link #get()} recomputes. */
    public void invalidateResult() {
        invalidateKey(NO_ARGS);
    }

    public String key() {
        return keyFor(NO_ARGS);
    }
}
