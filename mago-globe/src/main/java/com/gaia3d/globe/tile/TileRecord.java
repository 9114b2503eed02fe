package com.gaia3d.globe.tile;

import lombok.Getter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

/**
 * Cache entry of one tile. Created {@link TileStatus#PENDING} and moved exactly once to
 * {@link TileStatus#LOADED} or {@link TileStatus#FAILED}. Only the tile package may change it.
 */
public class TileRecord {
    private static final Geometry EMPTY_GEOMETRY = new GeometryFactory().createGeometryCollection();

    @Getter
    private final TileDescriptor descriptor;
    private volatile Geometry geometry = EMPTY_GEOMETRY;
    private volatile TileFailureReason failureReason;
    // written last so that a reader seeing a terminal status also sees its geometry
    private volatile TileStatus status = TileStatus.PENDING;

    TileRecord(TileDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public String getId() {
        return descriptor.getId();
    }

    public TileStatus getStatus() {
        return status;
    }

    /**
     * @return the tile features, empty unless loaded
     */
    public Geometry getGeometry() {
        return geometry;
    }

    /**
     * @return the failure cause, null unless failed
     */
    public TileFailureReason getFailureReason() {
        return failureReason;
    }

    public boolean isLoaded() {
        return status == TileStatus.LOADED;
    }

    synchronized void markLoaded(Geometry loadedGeometry) {
        requirePending(TileStatus.LOADED);
        this.geometry = loadedGeometry == null ? EMPTY_GEOMETRY : loadedGeometry;
        this.status = TileStatus.LOADED;
    }

    synchronized void markFailed(TileFailureReason reason) {
        requirePending(TileStatus.FAILED);
        this.geometry = EMPTY_GEOMETRY;
        this.failureReason = reason;
        this.status = TileStatus.FAILED;
    }

    private void requirePending(TileStatus target) {
        if (status != TileStatus.PENDING) {
            throw new IllegalStateException(
                    String.format("Tile %s is already %s and cannot become %s", getId(), status, target));
        }
    }

    @Override
    public String toString() {
        return "TileRecord[" + getId() + ", " + status + "]";
    }
}
