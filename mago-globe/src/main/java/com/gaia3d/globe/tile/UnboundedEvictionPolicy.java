package com.gaia3d.globe.tile;

import java.util.List;
import java.util.Map;

final class UnboundedEvictionPolicy implements TileEvictionPolicy {
    static final UnboundedEvictionPolicy INSTANCE = new UnboundedEvictionPolicy();

    private UnboundedEvictionPolicy() {
    }

    @Override
    public void recordInsert(String id) {
    }

    @Override
    public void recordAccess(String id) {
    }

    @Override
    public void recordRemoval(String id) {
    }

    @Override
    public List<String> selectVictims(Map<String, TileRecord> records) {
        return List.of();
    }
}
