package com.example.memocache.memo;

import com.example.memocache.core.InvalidTtlException;
import com.example.memocache.core.TtlCache;
import com.example.memocache.refresh.DirectRefreshStrategy;
import com.example.memocache.refresh.RefreshStrategy;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns plain functions into cached ones backed by an injected {@link TtlCache} (local, remote or
 * multi-level).
 *
 * <pre>{@code
 * MemoizedFunction<String, List<Instance>> instances =
 *     memoizer.function("ec2.describeInstances", ec2::describeInstances);
 * instances.apply("us-east-1"); // calls ec2
 * instances.apply("us-east-1"); // served from cache
 * }</pre>
 *
 * <p>A wrapped call returns exactly what the target returns and rethrows whatever it throws.
 * {@code null} results are handed back but not cached.
 */
public class Memoizer {

    private static final Logger log = LoggerFactory.getLogger(Memoizer.class);

    private final TtlCache cache;
    private final long defaultTtlSeconds;
    private final KeyGenerator defaultKeyGenerator;
    private final RefreshStrategy refreshStrategy;

    public Memoizer(TtlCache cache, long defaultTtlSeconds) {
        this(cache, defaultTtlSeconds, new DigestKeyGenerator(), new DirectRefreshStrategy());
    }

    public Memoizer(
        TtlCache cache,
        long defaultTtlSeconds,
        KeyGenerator defaultKeyGenerator,
        RefreshStrategy refreshStrategy
    ) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.defaultTtlSeconds = InvalidTtlException.requirePositive(defaultTtlSeconds);
        this.defaultKeyGenerator = Objects.requireNonNull(defaultKeyGenerator, "defaultKeyGenerator");
        this.refreshStrategy = Objects.requireNonNull(refreshStrategy, "refreshStrategy");
    }

    public <R> MemoizedSupplier<R> supplier(String name, Supplier<R> target) {
        return supplier(name, target, defaultTtlSeconds, defaultKeyGenerator);
    }

    public <R> MemoizedSupplier<R> supplier(String name, Supplier<R> target, long ttlSeconds, KeyGenerator keys) {
        return new MemoizedSupplier<>(this, name, ttlSeconds, keys, target);
    }

    public <T, R> MemoizedFunction<T, R> function(String name, Function<T, R> target) {
        return function(name, target, defaultTtlSeconds, defaultKeyGenerator);
    }

    public <T, R> MemoizedFunction<T, R> function(
        String name, Function<T, R> target, long ttlSeconds, KeyGenerator keys) {
        return new MemoizedFunction<>(this, name, ttlSeconds, keys, target);
    }

    public <T, U, R> MemoizedBiFunction<T, U, R> biFunction(String name, BiFunction<T, U, R> target) {
        return biFunction(name, target, defaultTtlSeconds, defaultKeyGenerator);
    }

    public <T, U, R> MemoizedBiFunction<T, U, R> biFunction(
        String name, BiFunction<T, U, R> target, long ttlSeconds, KeyGenerator keys) {
        return new MemoizedBiFunction<>(this, name, ttlSeconds, keys, target);
    }

    public <R> MemoizedVarargs<R> varargs(String name, VarargsFunction<R> target) {
        return varargs(name, target, defaultTtlSeconds, defaultKeyGenerator);
    }

    public <R> MemoizedVarargs<R> varargs(String name, VarargsFunction<R> target, long ttlSeconds, KeyGenerator keys) {
        return new MemoizedVarargs<>(this, name, ttlSeconds, keys, target);
    }

    /**
     * Cache lookup, then {@code target} on a miss with the result stored under {@code key}.
     */
    @SuppressWarnings("unchecked")
    <R> R lookupOrLoad(String key, long ttlSeconds, Supplier<R> target) {
        Optional<Object> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Memoized hit: key={}", key);
            return (R) cached.get();
        }
        return refreshStrategy.load(key, () -> {
            R result = target.get();
            if (result != null) {
                cache.put(key, result, ttlSeconds);
                log.debug("Memoized store: key={}, ttl={}s", key, ttlSeconds);
            }
            return result;
        });
    }

    public TtlCache getCache() {
        return cache;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public KeyGenerator getDefaultKeyGenerator() {
        return defaultKeyGenerator;
    }
}
