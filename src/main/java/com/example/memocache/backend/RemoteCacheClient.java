package com.example.memocache.backend;

import com.example.memocache.core.BackendUnavailableException;
import com.example.memocache.core.InvalidTtlException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Client for the shared remote tier (L2). Every call is bounded by {@code timeout}. */
public class RemoteCacheClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteCacheClient.class);

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final String keyPrefix;
    private final long defaultTtlSeconds;
    private final Duration timeout;

    public RemoteCacheClient(
        KeyValueStore store,
        JsonValueCodec codec,
        String keyPrefix,
        long defaultTtlSeconds,
        Duration timeout
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.defaultTtlSeconds = InvalidTtlException.requirePositive(defaultTtlSeconds);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
    }

    public Optional<Object> get(String key) throws BackendUnavailableException {
        String payload = await("GET", key, () -> store.get(keyPrefix + key));
        if (payload == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(payload));
    }

    public void put(String key, Object value) throws BackendUnavailableException {
        put(key, value, defaultTtlSeconds);
    }

    public void put(String key, Object value, long ttlSeconds) throws BackendUnavailableException {
        Objects.requireNonNull(value, "value");
        InvalidTtlException.requirePositive(ttlSeconds);
        String payload = codec.encode(value);
        await("SETEX", key, () -> store.setEx(keyPrefix + key, ttlSeconds, payload));
    }

    public boolean delete(String key) throws BackendUnavailableException {
        Boolean removed = await("DEL", key, () -> store.delete(keyPrefix + key));
        return Boolean.TRUE.equals(removed);
    }

    // payload is not transferred
    public boolean exists(String key) throws BackendUnavailableException {
        Boolean exists = await("EXISTS", key, () -> store.exists(keyPrefix + key));
        return Boolean.TRUE.equals(exists);
    }

    public long clear() throws BackendUnavailableException {
        Long removed = await("DEL", keyPrefix + "*", () -> store.deleteByPrefix(keyPrefix));
        return removed == null ? 0 : removed;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private <T> T await(String operation, String key, Supplier<CompletionStage<T>> call)
        throws BackendUnavailableException {
        try {
            return call.get().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw unavailable(operation, key, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw unavailable(operation, key, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable(operation, key, "interrupted", e);
        } catch (RuntimeException e) {
            // the client library may reject a call outright (pool shut down, connection refused)
            throw unavailable(operation, key, String.valueOf(e.getMessage()), e);
        }
    }

    private BackendUnavailableException unavailable(String operation, String key, String reason, Throwable cause) {
        log.warn("Remote cache {} failed: key={}, reason={}", operation, key, reason);
        return new BackendUnavailableException(operation, key, reason, cause);
    }
}
