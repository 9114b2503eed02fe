package com.gaia3d.globe.tile;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tile id to {@link TileRecord} map, the single source of truth for what has been fetched.
 * Confined to the event loop thread.
 */
@Slf4j
public class TileCache {
    private final Map<String, TileRecord> records = new HashMap<>();
    private final TileEvictionPolicy evictionPolicy;

    public TileCache() {
        this(TileEvictionPolicy.none());
    }

    public TileCache(TileEvictionPolicy evictionPolicy) {
        this.evictionPolicy = evictionPolicy;
    }

    public Optional<TileRecord> get(String id) {
        TileRecord record = records.get(id);
        if (record != null) {
            evictionPolicy.recordAccess(id);
        }
        return Optional.ofNullable(record);
    }

    /**
     * Returns the existing record for the descriptor, or registers a new pending one.
     */
    TileRequest getOrCreate(TileDescriptor descriptor) {
        String id = descriptor.getId();
        TileRecord existing = records.get(id);
        if (existing != null) {
            evictionPolicy.recordAccess(id);
            return new TileRequest(existing, false);
        }

        TileRecord created = new TileRecord(descriptor);
        records.put(id, created);
        evictionPolicy.recordInsert(id);
        evictIfNeeded();
        return new TileRequest(created, true);
    }

    /**
     * Called once a record became terminal, as it may now be evictable.
     */
    void recordSettled(TileRecord record) {
        evictIfNeeded();
    }

    private void evictIfNeeded() {
        List<String> victims = evictionPolicy.selectVictims(Collections.unmodifiableMap(records));
        for (String id : victims) {
            TileRecord removed = records.get(id);
            if (removed == null || !removed.getStatus().isTerminal()) {
                log.warn("[Tile][Cache] eviction policy selected a non-terminal tile {}, ignored.", id);
                continue;
            }
            records.remove(id);
            evictionPolicy.recordRemoval(id);
            log.debug("[Tile][Cache] evicted {} ({})", id, removed.getStatus());
        }
    }

    public int size() {
        return records.size();
    }

    public int count(TileStatus status) {
        int count = 0;
        for (TileRecord record : records.values()) {
            if (record.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    public Collection<TileRecord> getRecords() {
        return Collections.unmodifiableCollection(records.values());
    }
}
