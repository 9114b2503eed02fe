package com.gaia3d.globe.tile;

import lombok.Getter;

/**
 * Entry point of the tile layer: answers from the {@link TileCache} and sends misses to the
 * {@link BoundedTileLoader}. Must be called on the event loop thread.
 */
@Getter
public class TileManager {
    private final TileCache cache;
    private final BoundedTileLoader loader;
    private final Runnable onTileSettled;

    /**
     * @param onTileSettled default continuation of new requests, usually a redraw request
     */
    public TileManager(TileCache cache, BoundedTileLoader loader, Runnable onTileSettled) {
        this.cache = cache;
        this.loader = loader;
        this.onTileSettled = onTileSettled;
    }

    public TileRequest requestTile(TileDescriptor descriptor) {
        return requestTile(descriptor, onTileSettled);
    }

    /**
     * Returns the cached record whatever its status, or registers a pending one and queues its load.
     * Callers must check the status of the returned record.
     */
    public TileRequest requestTile(TileDescriptor descriptor, Runnable continuation) {
        TileRequest request = cache.getOrCreate(descriptor);
        if (request.isNewRequest()) {
            TileRecord record = request.getRecord();
            loader.enqueue(record, () -> {
                cache.recordSettled(record);
                continuation.run();
            });
        }
        return request;
    }

    public TileLoaderStats getStats() {
        return loader.getStats();
    }
}
