package com.example.memocache.memo;

public class MemoizedVarargs<R> extends MemoizedCall<R> implements VarargsFunction<R> {

    private final VarargsFunction<R> target;

    MemoizedVarargs(Memoizer memoizer, String functionId, long ttlSeconds, KeyGenerator keys, VarargsFunction<R> target) {
        super(memoizer, functionId, ttlSeconds, keys);
        this.target = target;
    }

    @Override
    public R apply(Object... args) {
        Object[] copy = args == null ? new Object[0] : args.clone();
        return invoke(copy, () -> target.apply(copy));
    }

    public void invalidateCall(Object... args) {
        invalidateKey(args);
    }

    public String key(Object... args) {
        return keyFor(args);
    }
}
