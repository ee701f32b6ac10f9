package com.example.memocache.memo;

import java.util.function.Function;

public class MemoizedFunction<T, R> extends MemoizedCall<R> implements Function<T, R> {

    private final Function<T, R> target;

    MemoizedFunction(Memoizer memoizer, String functionId, long ttlSeconds, KeyGenerator keys, Function<T, R> target) {
        super(memoizer, functionId, ttlSeconds, keys);
        this.target = target;
    }

    @Override
    public R apply(T arg) {
        return invoke(new Object[] {arg}, () -> target.apply(arg));
    }

    public void invalidate(T arg) {
        invalidateKey(new Object[] {arg});
    }

    public String key(T arg) {
        return keyFor(new Object[] {arg});
    }
}
