package com.gaia3d.globe.tile;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Least recently used cap on the number of cached tiles. Pending tiles are skipped,
 * so the cache may exceed the cap while many fetches are outstanding.
 * An evicted failed tile becomes requestable again.
 */
public class LruTileEvictionPolicy implements TileEvictionPolicy {
    @Getter
    private final int maxEntries;
    // oldest first
    private final LinkedHashSet<String> accessOrder = new LinkedHashSet<>();

    public LruTileEvictionPolicy(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public void recordInsert(String id) {
        accessOrder.remove(id);
        accessOrder.add(id);
    }

    @Override
    public void recordAccess(String id) {
        if (accessOrder.remove(id)) {
            accessOrder.add(id);
        }
    }

    @Override
    public void recordRemoval(String id) {
        accessOrder.remove(id);
    }

    @Override
    public List<String> selectVictims(Map<String, TileRecord> records) {
        int excess = records.size() - maxEntries;
        if (excess <= 0) {
            return List.of();
        }

        List<String> victims = new ArrayList<>(excess);
        Iterator<String> iterator = accessOrder.iterator();
        while (iterator.hasNext() && victims.size() < excess) {
            String id = iterator.next();
            TileRecord record = records.get(id);
            if (record != null && record.getStatus().isTerminal()) {
                victims.add(id);
            }
        }
        return victims;
    }
}
