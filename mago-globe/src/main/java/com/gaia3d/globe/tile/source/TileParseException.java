package com.gaia3d.globe.tile.source;

/**
 * A tile payload was fetched but is not valid GeoJSON.
 */
public class TileParseException extends RuntimeException {

    public TileParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
