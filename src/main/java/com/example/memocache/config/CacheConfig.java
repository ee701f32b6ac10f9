package com.example.memocache.config;

import com.example.memocache.backend.InMemoryKeyValueStore;
import com.example.memocache.backend.JsonValueCodec;
import com.example.memocache.backend.KeyValueStore;
import com.example.memocache.backend.RedissonKeyValueStore;
import com.example.memocache.backend.RemoteCacheClient;
import com.example.memocache.core.LocalCache;
import com.example.memocache.core.MultiLevelCache;
import com.example.memocache.core.TtlCache;
import com.example.memocache.eviction.EvictionPolicy;
import com.example.memocache.memo.DigestKeyGenerator;
import com.example.memocache.memo.Memoizer;
import com.example.memocache.refresh.CoalescingRefreshStrategy;
import com.example.memocache.refresh.DirectRefreshStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the two tiers and the memoizer. Every component receives its cache through its
 * constructor; there is no static cache instance.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Value("${memocache.local.default-ttl-seconds:300}")
    private long localTtlSeconds;

    @Value("${memocache.local.max-entries:10000}")
    private int maxLocalEntries;

    @Value("${memocache.local.eviction:fifo}")
    private String eviction;

    @Value("${memocache.remote.default-ttl-seconds:3600}")
    private long remoteTtlSeconds;

    @Value("${memocache.remote.timeout-ms:500}")
    private long remoteTimeoutMillis;

    @Value("${memocache.remote.key-prefix:memo:}")
    private String keyPrefix;

    @Value("${memocache.remote.trusted-packages:com.example.}")
    private List<String> trustedPackages;

    @Value("${memocache.memo.default-ttl-seconds:300}")
    private long memoTtlSeconds;

    @Value("${memocache.memo.coalescing:false}")
    private boolean coalescing;

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalCache localCache(Clock cacheClock) {
        log.info("Local cache: ttl={}s, maxEntries={}, eviction={}", localTtlSeconds, maxLocalEntries, eviction);
        return new LocalCache(localTtlSeconds, maxLocalEntries, EvictionPolicy.named(eviction), cacheClock);
    }

    @Bean
    public JsonValueCodec jsonValueCodec(ObjectMapper objectMapper) {
        List<String> packages = new ArrayList<>(JsonValueCodec.DEFAULT_TRUSTED_PACKAGES);
        packages.addAll(trustedPackages);
        return new JsonValueCodec(objectMapper, packages);
    }

    @Bean
    public RemoteCacheClient remoteCacheClient(KeyValueStore keyValueStore, JsonValueCodec jsonValueCodec) {
        log.info("Remote cache: ttl={}s, timeout={}ms, prefix={}", remoteTtlSeconds, remoteTimeoutMillis, keyPrefix);
        return new RemoteCacheClient(
            keyValueStore, jsonValueCodec, keyPrefix, remoteTtlSeconds, Duration.ofMillis(remoteTimeoutMillis));
    }

    @Bean
    @Primary
    public MultiLevelCache multiLevelCache(LocalCache localCache, RemoteCacheClient remoteCacheClient) {
        return new MultiLevelCache(localCache, remoteCacheClient);
    }

    @Bean
    public Memoizer memoizer(TtlCache cache) {
        return new Memoizer(
            cache,
            memoTtlSeconds,
            new DigestKeyGenerator(),
            coalescing ? new CoalescingRefreshStrategy() : new DirectRefreshStrategy());
    }

    @Configuration
    @ConditionalOnProperty(name = "memocache.remote.mode", havingValue = "redis", matchIfMissing = true)
    static class RedisStoreConfig {

        private static final String REDISSON_HOST_PREFIX = "redis://";

        @Value("${memocache.remote.address:redis://localhost:6379}")
        private String address;

        @Value("${memocache.remote.timeout-ms:500}")
        private int timeoutMillis;

        @Bean(destroyMethod = "shutdown")
        public RedissonClient redissonClient() {
            Config config = new Config();
            config.setLazyInitialization(true);
            config
                .useSingleServer()
                .setAddress(address.contains("://") ? address : REDISSON_HOST_PREFIX + address)
                .setTimeout(timeoutMillis)
                .setConnectTimeout(timeoutMillis)
                .setRetryAttempts(0);
            return Redisson.create(config);
        }

        @Bean
        public KeyValueStore redissonKeyValueStore(RedissonClient redissonClient) {
            return new RedissonKeyValueStore(redissonClient);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "memocache.remote.mode", havingValue = "memory")
    static class InMemoryStoreConfig {

        @Bean
        public KeyValueStore inMemoryKeyValueStore(Clock cacheClock) {
            log.info("Remote cache backed by the in-process store");
            return new InMemoryKeyValueStore(cacheClock);
        }
    }
}
