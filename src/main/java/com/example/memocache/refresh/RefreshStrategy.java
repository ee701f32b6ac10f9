package com.example.memocache.refresh;

import java.util.function.Supplier;

/**
 * How a cache miss gets filled. {@code loader} computes the value and stores it; the strategy
 * decides how many concurrent callers missing the same key get to run it.
 */
public interface RefreshStrategy {

    <R> R load(String key, Supplier<R> loader);
}
