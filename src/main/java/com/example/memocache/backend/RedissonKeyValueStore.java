package com.example.memocache.backend;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * {@link KeyValueStore} over Redis. The {@link RedissonClient} owns the connection pool and is
 * shared for the life of the process.
 */
public class RedissonKeyValueStore implements KeyValueStore {

    private final RedissonClient redissonClient;

    public RedissonKeyValueStore(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    @Override
    public CompletionStage<String> get(String key) {
        return bucket(key).getAsync();
    }

    @Override
    public CompletionStage<Void> setEx(String key, long ttlSeconds, String payload) {
        return bucket(key).setAsync(payload, ttlSeconds, TimeUnit.SECONDS);
    }

    @Override
    public CompletionStage<Boolean> delete(String key) {
        return bucket(key).deleteAsync();
    }

    @Override
    public CompletionStage<Boolean> exists(String key) {
        return bucket(key).isExistsAsync();
    }

    @Override
    public CompletionStage<Long> deleteByPrefix(String prefix) {
        return redissonClient.getKeys().deleteByPatternAsync(prefix + "*");
    }

    private RBucket<String> bucket(String key) {
        return redissonClient.getBucket(key, StringCodec.INSTANCE);
    }
}
