package com.example.memocache.memo;

import java.util.function.BiFunction;

public class MemoizedBiFunction<T, U, R> extends MemoizedCall<R> implements BiFunction<T, U, R> {

    private final BiFunction<T, U, R> target;

    MemoizedBiFunction(
        Memoizer memoizer, String functionId, long ttlSeconds, KeyGenerator keys, BiFunction<T, U, R> target) {
        super(memoizer, functionId, ttlSeconds, keys);
        this.target = target;
    }

    @Override
    public R apply(T first, U second) {
        return invoke(new Object[] {first, second}, () -> target.apply(first, second));
    }

    public void invalidate(T first, U second) {
        invalidateKey(new Object[] {first, second});
    }

    public String key(T first, U second) {
        return keyFor(new Object[] {first, second});
    }
}
