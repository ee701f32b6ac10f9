package com.example.memocache.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Slow stand-in for a cloud inventory API: the kind of call the memoizer exists to avoid
 * repeating.
 */
@Component
public class MockInventoryBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private volatile long latencyMillis = 500;

    // Simulates a slow inventory listing
    public List<String> listInstances(String region) {
        requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        List<String> instances = new ArrayList<>();
        int count = Math.floorMod(region.hashCode(), 5) + 1;
        for (int i = 0; i < count; i++) {
            instances.add("i-" + region + "-" + i);
        }
        return instances;
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
