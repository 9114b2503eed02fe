package com.gaia3d.globe.render;

import com.gaia3d.globe.field.FieldGrid;
import com.gaia3d.globe.tile.TileLoaderStats;
import com.gaia3d.globe.tile.TileRecord;
import com.gaia3d.globe.tile.TileTier;
import com.gaia3d.globe.view.ViewState;
import lombok.Builder;
import lombok.Getter;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

/**
 * Everything one draw pass needs, captured at composition time. Tile lists hold loaded tiles only.
 */
@Getter
@Builder
public class GlobeFrame {
    private final long frameNumber;
    private final ViewState view;
    private final TileTier baseTier;
    private final TileTier activeTier;
    private final List<TileRecord> baseTiles;
    private final List<TileRecord> detailTiles;
    private final int pendingTiles;
    private final int failedTiles;
    /** null when the overlay is disabled */
    private final FieldGrid fieldGrid;
    private final DatasetResolution datasetResolution;
    private final Geometry surfaceGeometry;
    private final TileLoaderStats loaderStats;

    public boolean hasDetailLayer() {
        return !activeTier.equals(baseTier);
    }
}
