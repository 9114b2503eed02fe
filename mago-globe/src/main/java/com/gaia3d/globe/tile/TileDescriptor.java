package com.gaia3d.globe.tile;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable address of one tile. {@code x}/{@code y} are the longitude/latitude in degrees
 * of the tile's south-west corner.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TileDescriptor {
    private final TileTier tier;
    private final int x;
    private final int y;
    @EqualsAndHashCode.Include
    private final String id;

    public TileDescriptor(TileTier tier, int x, int y) {
        this.tier = tier;
        this.x = x;
        this.y = y;
        this.id = TileKeys.keyOf(tier, x, y);
    }

    public double getCenterLongitude() {
        return x + tier.getTileSizeDegrees() / 2.0;
    }

    public double getCenterLatitude() {
        return y + tier.getTileSizeDegrees() / 2.0;
    }

    @Override
    public String toString() {
        return id;
    }
}
