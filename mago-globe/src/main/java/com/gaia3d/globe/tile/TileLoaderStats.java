package com.gaia3d.globe.tile;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time counters of a {@link BoundedTileLoader}.
 * {@code queued == requested - loaded - failed - inFlight} always holds.
 */
@Getter
@ToString
@AllArgsConstructor
public class TileLoaderStats {
    private final long requested;
    private final long loaded;
    private final long failed;
    private final int inFlight;
    private final int queued;

    public boolean isIdle() {
        return inFlight == 0 && queued == 0;
    }
}
