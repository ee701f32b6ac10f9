package com.example.memocache.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.memocache.eviction.FifoEvictionPolicy;
import com.example.memocache.eviction.LruEvictionPolicy;
import com.example.memocache.support.MutableClock;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LocalCacheTest {

    private static final long DEFAULT_TTL = 60;

    private MutableClock clock;
    private LocalCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new LocalCache(DEFAULT_TTL, 0, new FifoEvictionPolicy(), clock);
    }

    @Nested
    @DisplayName("get / put")
    class GetPutTest {

        @Test
        @DisplayName("put then get returns the value immediately")
        void putThenGet() {
            cache.put("k", "v", 10);

            assertThat(cache.get("k")).contains("v");
        }

        @Test
        @DisplayName("absent key is a miss")
        void absentKeyIsMiss() {
            assertThat(cache.get("missing")).isEmpty();
            assertThat(cache.stats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("put without TTL uses the configured default")
        void defaultTtl() {
            cache.put("k", "v");

            CacheEntry<Object> entry = cache.inspect("k").orElseThrow();
            assertThat(entry.ttlSeconds).isEqualTo(DEFAULT_TTL);
            assertThat(entry.expiresAt - entry.createdAt).isEqualTo(DEFAULT_TTL * 1000);
        }

        @Test
        @DisplayName("put on an existing key replaces the entry with fresh timestamps")
        void overwriteReplacesEntry() {
            cache.put("k", "old", 10);
            cache.get("k");
            clock.advanceSeconds(5);

            cache.put("k", "new", 10);

            CacheEntry<Object> entry = cache.inspect("k").orElseThrow();
            assertThat(entry.value).isEqualTo("new");
            assertThat(entry.createdAt).isEqualTo(clock.millis());
            assertThat(entry.getHitCount()).isZero();
            clock.advanceSeconds(9);
            assertThat(cache.get("k")).contains("new");
        }

        @Test
        @DisplayName("reads bump hit count and last access time")
        void readsTrackHits() {
            cache.put("k", "v", 10);
            clock.advanceSeconds(2);

            cache.get("k");
            cache.get("k");

            CacheEntry<Object> entry = cache.inspect("k").orElseThrow();
            assertThat(entry.getHitCount()).isEqualTo(2);
            assertThat(entry.getLastAccessedAt()).isEqualTo(clock.millis());
        }

        @Test
        @DisplayName("non-positive TTL is rejected")
        void invalidTtl() {
            assertThatThrownBy(() -> cache.put("k", "v", 0)).isInstanceOf(InvalidTtlException.class);
            assertThatThrownBy(() -> cache.put("k", "v", -5))
                .isInstanceOf(InvalidTtlException.class)
                .hasMessageContaining("-5");
            assertThat(cache.inspect("k")).isEmpty();
        }

        @Test
        @DisplayName("non-positive default TTL is rejected at construction")
        void invalidDefaultTtl() {
            assertThatThrownBy(() -> new LocalCache(0)).isInstanceOf(InvalidTtlException.class);
        }
    }

    @Nested
    @DisplayName("expiration")
    class ExpirationTest {

        @Test
        @DisplayName("entry is dead exactly at expiresAt")
        void deadAtExpiry() {
            cache.put("k", "v", 1);

            clock.advance(Duration.ofMillis(999));
            assertThat(cache.get("k")).contains("v");

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("very large TTLs never wrap into the past")
        void hugeTtl() {
            cache.put("big", "v", Long.MAX_VALUE / 100);
            cache.put("max", "v", Long.MAX_VALUE);

            assertThat(cache.get("big")).contains("v");
            assertThat(cache.get("max")).contains("v");
            assertThat(cache.inspect("max").orElseThrow().expiresAt).isEqualTo(Long.MAX_VALUE);
            clock.advanceSeconds(3_650L * 24 * 3600);
            assertThat(cache.get("max")).contains("v");
            assertThat(cache.stats().averageTtlSeconds()).isPositive();
        }

        @Test
        @DisplayName("dead entry is removed on read")
        void lazyExpiration() {
            cache.put("k", "v", 1);
            clock.advanceSeconds(2);

            assertThat(cache.get("k")).isEmpty();
            assertThat(cache.inspect("k")).isEmpty();
            assertThat(cache.stats().expirations()).isEqualTo(1);
        }

        @Test
        @DisplayName("entry expires in real time")
        void expiresWithSystemClock() throws InterruptedException {
            LocalCache realTime = new LocalCache(60, 0, new FifoEvictionPolicy(), Clock.systemUTC());
            realTime.put("k", "v", 1);

            Thread.sleep(1500);

            assertThat(realTime.get("k")).isEmpty();
        }
    }

    @Nested
    @DisplayName("delete / clear / sweep")
    class RemovalTest {

        @Test
        @DisplayName("delete is idempotent")
        void deleteIdempotent() {
            cache.put("k", "v");

            assertThat(cache.delete("k")).isTrue();
            assertThat(cache.delete("k")).isFalse();
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("clear drops every entry")
        void clearAll() {
            cache.put("a", 1);
            cache.put("b", 2);

            cache.clear();

            assertThat(cache.stats().entryCount()).isZero();
            assertThat(cache.get("a")).isEmpty();
        }

        @Test
        @DisplayName("sweep removes exactly the dead entries")
        void sweepCountsDeadEntries() {
            int shortLived = 7;
            int longLived = 4;
            for (int i = 0; i < shortLived; i++) {
                cache.put("short-" + i, i, 1);
            }
            for (int i = 0; i < longLived; i++) {
                cache.put("long-" + i, i, 3600);
            }

            clock.advanceSeconds(2);

            assertThat(cache.sweepExpired()).isEqualTo(shortLived);
            assertThat(cache.stats().entryCount()).isEqualTo(longLived);
            assertThat(cache.sweepExpired()).isZero();
        }
    }

    @Nested
    @DisplayName("stats")
    class StatsTest {

        @Test
        @DisplayName("snapshot reports count, hits and average TTL")
        void snapshot() {
            cache.put("a", "x", 10);
            cache.put("b", "y", 30);
            cache.get("a");
            cache.get("a");
            cache.get("b");

            CacheStats stats = cache.stats();

            assertThat(stats.entryCount()).isEqualTo(2);
            assertThat(stats.totalHits()).isEqualTo(3);
            assertThat(stats.averageTtlSeconds()).isEqualTo(20.0);
        }

        @Test
        @DisplayName("stats does not purge dead entries")
        void readOnly() {
            cache.put("a", "x", 1);
            clock.advanceSeconds(5);

            cache.stats();

            assertThat(cache.inspect("a")).isPresent();
            assertThat(cache.stats().entryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("empty cache has zero average TTL")
        void emptyCache() {
            assertThat(cache.stats().averageTtlSeconds()).isZero();
        }
    }

    @Nested
    @DisplayName("size cap")
    class CapacityTest {

        @Test
        @DisplayName("oldest-created entry is evicted first")
        void fifoEviction() {
            LocalCache capped = new LocalCache(60, 2, new FifoEvictionPolicy(), clock);
            capped.put("a", 1);
            capped.put("b", 2);
            capped.get("a");

            capped.put("c", 3);

            assertThat(capped.get("a")).isEmpty();
            assertThat(capped.get("b")).contains(2);
            assertThat(capped.get("c")).contains(3);
            assertThat(capped.stats().evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("LRU policy keeps recently read entries")
        void lruEviction() {
            LocalCache capped = new LocalCache(60, 2, new LruEvictionPolicy(), clock);
            capped.put("a", 1);
            capped.put("b", 2);
            capped.get("a");

            capped.put("c", 3);

            assertThat(capped.inspect("a")).isPresent();
            assertThat(capped.inspect("b")).isEmpty();
        }

        @Test
        @DisplayName("dead entries are purged before anything live is evicted")
        void expiredFirst() {
            LocalCache capped = new LocalCache(60, 2, new FifoEvictionPolicy(), clock);
            capped.put("old", 1, 60);
            capped.put("short", 2, 1);
            clock.advanceSeconds(2);

            capped.put("new", 3);

            assertThat(capped.get("old")).contains(1);
            assertThat(capped.get("new")).contains(3);
            assertThat(capped.stats().evictions()).isZero();
            assertThat(capped.stats().expirations()).isEqualTo(1);
        }

        @Test
        @DisplayName("negative cap is rejected")
        void negativeCap() {
            assertThatThrownBy(() -> new LocalCache(60, -1, new FifoEvictionPolicy(), clock))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTest {

        @Test
        @DisplayName("100 concurrent writers and readers on one key leave one written value")
        void concurrentSameKey() throws Exception {
            int workers = 100;
            ExecutorService pool = Executors.newFixedThreadPool(16);
            CountDownLatch start = new CountDownLatch(1);
            Set<String> written = new HashSet<>();
            List<Future<Optional<Object>>> results = new ArrayList<>();

            for (int i = 0; i < workers; i++) {
                String value = "value-" + i;
                boolean writer = i % 2 == 0;
                if (writer) {
                    written.add(value);
                }
                results.add(pool.submit(() -> {
                    start.await();
                    if (writer) {
                        cache.put("shared", value, 60);
                        return Optional.empty();
                    }
                    return cache.get("shared");
                }));
            }
            start.countDown();

            for (Future<Optional<Object>> result : results) {
                result.get(10, TimeUnit.SECONDS).ifPresent(read -> assertThat(written).contains((String) read));
            }
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            Object last = cache.get("shared").orElseThrow();
            assertThat(written).contains((String) last);
            assertThat(cache.stats().entryCount()).isEqualTo(1);
        }
    }
}
