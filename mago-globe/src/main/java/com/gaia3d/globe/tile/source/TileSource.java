package com.gaia3d.globe.tile.source;

import com.gaia3d.globe.tile.TileDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous provider of raw tile payloads. A failed fetch completes the future exceptionally,
 * preferably with a {@link TileFetchException}.
 */
public interface TileSource {

    /**
     * Fetches a named resource relative to the source root.
     */
    CompletableFuture<byte[]> fetchResource(String resourceName);

    TileNameTemplate getNameTemplate();

    default CompletableFuture<byte[]> fetch(TileDescriptor descriptor) {
        return fetchResource(getNameTemplate().resolve(descriptor));
    }
}
