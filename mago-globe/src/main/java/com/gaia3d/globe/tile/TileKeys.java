package com.gaia3d.globe.tile;

import com.gaia3d.util.GlobeUtils;

/**
 * Stable tile identifiers, unique per tier and coordinate.
 */
public class TileKeys {
    private static final char SEPARATOR = '/';

    private TileKeys() {
    }

    public static String keyOf(TileTier tier, int x, int y) {
        return tier.getName() + SEPARATOR + x + SEPARATOR + y;
    }

    public static TileDescriptor descriptor(TileTier tier, int x, int y) {
        return new TileDescriptor(tier, x, y);
    }

    /**
     * Descriptor of the tile that contains the given geographic position.
     */
    public static TileDescriptor descriptorAt(TileTier tier, double lonDeg, double latDeg) {
        double size = tier.getTileSizeDegrees();
        double lon = GlobeUtils.normalizeLongitude(lonDeg);
        double cellLon = -180.0 + Math.floor((lon + 180.0) / size) * size;
        double cellLat = -90.0 + Math.floor((Math.min(latDeg, 90.0 - 1e-9) + 90.0) / size) * size;
        return new TileDescriptor(tier, (int) Math.floor(cellLon), (int) Math.floor(cellLat));
    }
}
