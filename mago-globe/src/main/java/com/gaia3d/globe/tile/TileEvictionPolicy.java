package com.gaia3d.globe.tile;

import java.util.List;
import java.util.Map;

/**
 * Decides which cached tiles may be dropped. Implementations must never select a pending record,
 * otherwise a duplicate fetch could be dispatched for it.
 */
public interface TileEvictionPolicy {

    void recordInsert(String id);

    void recordAccess(String id);

    void recordRemoval(String id);

    /**
     * @param records current cache content, keyed by tile id
     * @return ids to evict, possibly empty
     */
    List<String> selectVictims(Map<String, TileRecord> records);

    /**
     * Session scoped cache without eviction.
     */
    static TileEvictionPolicy none() {
        return UnboundedEvictionPolicy.INSTANCE;
    }
}
