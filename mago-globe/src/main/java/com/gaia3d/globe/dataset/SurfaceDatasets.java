package com.gaia3d.globe.dataset;

import com.gaia3d.globe.render.DatasetResolution;
import com.gaia3d.globe.scheduler.EventLoop;
import com.gaia3d.globe.tile.source.TileGeometryParser;
import com.gaia3d.globe.tile.source.TileSource;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

import java.util.concurrent.CompletableFuture;

/**
 * Low and high resolution land datasets covering the whole globe, loaded once in the background.
 * A dataset that failed to load stays unavailable and the other one is used instead.
 */
@Slf4j
public class SurfaceDatasets {
    public static final String DEFAULT_LOW_RES = "land_110m.json";
    public static final String DEFAULT_HIGH_RES = "land_50m.json";

    private final EventLoop eventLoop;
    private final TileSource source;
    private final TileGeometryParser parser;
    @Getter
    private final String lowResName;
    @Getter
    private final String highResName;

    private volatile Geometry lowRes;
    private volatile Geometry highRes;
    private volatile boolean lowResAvailable;
    private volatile boolean highResAvailable;

    /**
     * Called on the loop thread with the resolution that just finished loading.
     */
    @Setter
    private AvailabilityListener availabilityListener = (resolution, available) -> { };

    public SurfaceDatasets(EventLoop eventLoop, TileSource source, TileGeometryParser parser, String lowResName, String highResName) {
        this.eventLoop = eventLoop;
        this.source = source;
        this.parser = parser;
        this.lowResName = lowResName;
        this.highResName = highResName;
        Geometry empty = parser.getGeometryFactory().createGeometryCollection();
        this.lowRes = empty;
        this.highRes = empty;
    }

    /**
     * Starts both loads. The future completes once both settled, successfully or not.
     */
    public CompletableFuture<Void> load() {
        CompletableFuture<Void> low = load(DatasetResolution.LOW, lowResName);
        CompletableFuture<Void> high = load(DatasetResolution.HIGH, highResName);
        return CompletableFuture.allOf(low, high);
    }

    private CompletableFuture<Void> load(DatasetResolution resolution, String name) {
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> settled = new CompletableFuture<>();
        CompletableFuture<Geometry> result;
        try {
            result = source.fetchResource(name).thenApply(parser::parse);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete((geometry, throwable) -> eventLoop.execute(() -> {
            try {
                if (throwable == null) {
                    store(resolution, geometry);
                    log.info("[Dataset] {} resolution land loaded from {} ({} geometries)", resolution, name, geometry.getNumGeometries());
                } else {
                    log.error("[Dataset] failed to load {} resolution land from {}: {}", resolution, name, throwable.getMessage());
                }
                availabilityListener.onAvailabilityChanged(resolution, throwable == null);
            } finally {
                settled.complete(null);
            }
        }));
        return settled;
    }

    private void store(DatasetResolution resolution, Geometry geometry) {
        if (resolution == DatasetResolution.HIGH) {
            highRes = geometry;
            highResAvailable = true;
        } else {
            lowRes = geometry;
            lowResAvailable = true;
        }
    }

    /**
     * The dataset to draw for the switch state, falling back to whichever one is available.
     */
    public Geometry select(DatasetResolution resolution) {
        if (resolution == DatasetResolution.HIGH && highResAvailable) {
            return highRes;
        }
        if (lowResAvailable) {
            return lowRes;
        }
        return highResAvailable ? highRes : lowRes;
    }

    public boolean isAvailable(DatasetResolution resolution) {
        return resolution == DatasetResolution.HIGH ? highResAvailable : lowResAvailable;
    }

    @FunctionalInterface
    public interface AvailabilityListener {
        void onAvailabilityChanged(DatasetResolution resolution, boolean available);
    }
}
