package com.example.memocache.core;

/**
 * Read-only snapshot of a cache tier.
 *
 * @param entryCount        stored entries, or {@link #UNKNOWN} when the tier cannot tell
 * @param totalHits         successful reads
 * @param averageTtlSeconds mean TTL of the stored entries
 * @param misses            reads that found nothing live
 * @param evictions         entries dropped to respect the size cap
 * @param expirations       dead entries purged lazily or by a sweep
 * @param backendFailures   remote calls that failed and were absorbed
 */
public record CacheStats(
    long entryCount,
    long totalHits,
    double averageTtlSeconds,
    long misses,
    long evictions,
    long expirations,
    long backendFailures
) {

    public static final long UNKNOWN = -1;

    public CacheStats withBackendFailures(long failures) {
        return new CacheStats(entryCount, totalHits, averageTtlSeconds, misses, evictions, expirations, failures);
    }
}
