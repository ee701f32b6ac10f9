package com.example.memocache.api;

import com.example.memocache.backend.MockInventoryBackend;
import com.example.memocache.core.LocalCache;
import com.example.memocache.core.TtlCache;
import com.example.memocache.memo.MemoizedFunction;
import com.example.memocache.memo.Memoizer;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private final MockInventoryBackend backend;
    private final TtlCache cache;
    private final LocalCache localCache;
    private final MemoizedFunction<String, List<String>> instancesByRegion;

    public CacheController(MockInventoryBackend backend, Memoizer memoizer, LocalCache localCache) {
        this.backend = backend;
        this.cache = memoizer.getCache();
        this.localCache = localCache;
        this.instancesByRegion = memoizer.function("inventory.listInstances", backend::listInstances);
    }

    @GetMapping("/instances")
    public List<String> getInstances(@RequestParam String region) {
        return instancesByRegion.apply(region);
    }

    @DeleteMapping("/instances")
    public ResponseEntity<Void> invalidateInstances(@RequestParam String region) {
        instancesByRegion.invalidate(region);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        return Map.of(
            "cache", instancesByRegion.statistics(),
            "local", localCache.stats(),
            "backendRequests", backend.getRequestCount()
        );
    }

    @PostMapping("/sweep")
    public Map<String, Integer> sweep() {
        return Map.of("removed", localCache.sweepExpired());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateAll() {
        backend.resetCount();
        instancesByRegion.invalidate();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{key}")
    public Map<String, Object> delete(@PathVariable String key) {
        return Map.of("key", key, "removed", cache.delete(key));
    }

    @PostMapping("/config")
    public String configure(@RequestParam(defaultValue = "500") long latency) {
        backend.setLatencyMillis(latency);
        return "Backend latency set to " + latency + "ms";
    }
}
