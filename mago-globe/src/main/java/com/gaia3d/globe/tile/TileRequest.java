package com.gaia3d.globe.tile;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Answer of {@link TileManager#requestTile}. Callers must check the record status;
 * a request that is not new may still be pending.
 */
@Getter
@AllArgsConstructor
public class TileRequest {
    private final TileRecord record;
    private final boolean newRequest;
}
