package com.example.memocache.eviction;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;

/**
 * Evicts the oldest-created entry first. Reads do not change the order; a re-put counts as a
 * fresh creation and moves the key to the back.
 */
public class FifoEvictionPolicy implements EvictionPolicy {

    private final LinkedHashSet<String> insertionOrder = new LinkedHashSet<>();

    @Override
    public void onInsert(String key) {
        insertionOrder.remove(key);
        insertionOrder.add(key);
    }

    @Override
    public void onHit(String key) {
        // creation order only
    }

    @Override
    public void onRemove(String key) {
        insertionOrder.remove(key);
    }

    @Override
    public void clear() {
        insertionOrder.clear();
    }

    @Override
    public Optional<String> selectVictim() {
        Iterator<String> it = insertionOrder.iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        String victim = it.next();
        it.remove();
        return Optional.of(victim);
    }
}
