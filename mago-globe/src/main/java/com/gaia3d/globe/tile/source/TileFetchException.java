package com.gaia3d.globe.tile.source;

import java.io.IOException;

/**
 * A tile payload could not be obtained: missing file, I/O error or non-2xx HTTP answer.
 */
public class TileFetchException extends IOException {

    public TileFetchException(String message) {
        super(message);
    }

    public TileFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
