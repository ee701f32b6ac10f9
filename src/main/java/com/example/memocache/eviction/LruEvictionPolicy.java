package com.example.memocache.eviction;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class LruEvictionPolicy implements EvictionPolicy {

    // LinkedHashMap in access-order mode: accessOrder = true
    private final LinkedHashMap<String, Boolean> order =
        new LinkedHashMap<>(16, 0.75f, true);

    @Override
    public void onInsert(String key) {
        order.put(key, Boolean.TRUE);
    }

    @Override
    public void onHit(String key) {
        // access-order LinkedHashMap moves key to end on get
        order.get(key);
    }

    @Override
    public void onRemove(String key) {
        order.remove(key);
    }

    @Override
    public void clear() {
        order.clear();
    }

    @Override
    public Optional<String> selectVictim() {
        Iterator<Map.Entry<String, Boolean>> it = order.entrySet().iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        String victim = it.next().getKey();
        it.remove();
        return Optional.of(victim);
    }
}
