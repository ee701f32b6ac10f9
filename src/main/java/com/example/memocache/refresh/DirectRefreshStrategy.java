package com.example.memocache.refresh;

import java.util.function.Supplier;

/**
 * Every caller that misses runs the loader itself. Concurrent misses on one key all recompute
 * (thundering herd).
 */
public class DirectRefreshStrategy implements RefreshStrategy {

    @Override
    public <R> R load(String key, Supplier<R> loader) {
        return loader.get();
    }
}
