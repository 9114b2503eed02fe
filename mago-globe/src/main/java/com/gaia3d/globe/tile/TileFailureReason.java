package com.gaia3d.globe.tile;

/**
 * Why a tile ended up {@link TileStatus#FAILED}. Both are terminal for the session.
 */
public enum TileFailureReason {
    /** network, HTTP or file system error, including a missing tile */
    TRANSPORT,
    /** payload is not a GeoJSON geometry collection */
    PARSE
}
