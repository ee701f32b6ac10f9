package com.example.memocache.backend;

import java.util.concurrent.CompletionStage;

/**
 * Remote key/value service with server-side expiry. Every call is asynchronous so the caller can
 * bound it with its own timeout; a failed stage means the backend could not serve the request.
 */
public interface KeyValueStore {

    /** GET: completes with the stored payload, or {@code null} when absent or expired. */
    CompletionStage<String> get(String key);

    /** SETEX: stores {@code payload}, expiring it after {@code ttlSeconds}. */
    CompletionStage<Void> setEx(String key, long ttlSeconds, String payload);

    /** DEL: completes with whether a key was removed. Absent keys are not an error. */
    CompletionStage<Boolean> delete(String key);

    /** EXISTS */
    CompletionStage<Boolean> exists(String key);

    /** Deletes every key starting with {@code prefix}; completes with the number removed. */
    CompletionStage<Long> deleteByPrefix(String prefix);
}
