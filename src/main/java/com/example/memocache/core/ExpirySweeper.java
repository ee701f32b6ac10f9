package com.example.memocache.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically purges dead local entries so they stop holding memory between reads. */
@Component
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final LocalCache localCache;

    public ExpirySweeper(LocalCache localCache) {
        this.localCache = localCache;
    }

    @Scheduled(
        fixedDelayString = "${memocache.local.sweep-interval-ms:60000}",
        initialDelayString = "${memocache.local.sweep-interval-ms:60000}")
    public int sweep() {
        int removed = localCache.sweepExpired();
        if (removed > 0) {
            log.info("Swept {} expired local entries", removed);
        }
        return removed;
    }
}
