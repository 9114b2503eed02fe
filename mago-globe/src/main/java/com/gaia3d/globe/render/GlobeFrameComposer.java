package com.gaia3d.globe.render;

import com.gaia3d.globe.dataset.SurfaceDatasets;
import com.gaia3d.globe.field.FieldGrid;
import com.gaia3d.globe.field.FieldSampleCache;
import com.gaia3d.globe.tile.LodPolicy;
import com.gaia3d.globe.tile.TileDescriptor;
import com.gaia3d.globe.tile.TileManager;
import com.gaia3d.globe.tile.TileRecord;
import com.gaia3d.globe.tile.TileStatus;
import com.gaia3d.globe.tile.TileTier;
import com.gaia3d.globe.tile.VisibilityCalculator;
import com.gaia3d.globe.view.ViewState;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The draw pass: works out which tiles and which field grid the current view needs,
 * requests what is missing and hands what is available to the {@link FrameRenderer}.
 * Never waits for a fetch.
 */
public class GlobeFrameComposer implements Runnable {
    private final Supplier<ViewState> liveView;
    private final VisibilityCalculator visibilityCalculator;
    private final LodPolicy lodPolicy;
    private final TileManager tileManager;
    private final FieldSampleCache fieldSampleCache;
    private final DatasetLodSwitch datasetLodSwitch;
    private final SurfaceDatasets surfaceDatasets;
    private final FrameRenderer frameRenderer;

    @Getter
    @Setter
    private boolean fieldOverlayEnabled = true;
    private long frameNumber = 0;

    public GlobeFrameComposer(Supplier<ViewState> liveView, VisibilityCalculator visibilityCalculator, LodPolicy lodPolicy,
                              TileManager tileManager, FieldSampleCache fieldSampleCache, DatasetLodSwitch datasetLodSwitch,
                              SurfaceDatasets surfaceDatasets, FrameRenderer frameRenderer) {
        this.liveView = liveView;
        this.visibilityCalculator = visibilityCalculator;
        this.lodPolicy = lodPolicy;
        this.tileManager = tileManager;
        this.fieldSampleCache = fieldSampleCache;
        this.datasetLodSwitch = datasetLodSwitch;
        this.surfaceDatasets = surfaceDatasets;
        this.frameRenderer = frameRenderer;
    }

    @Override
    public void run() {
        frameRenderer.render(compose());
    }

    public GlobeFrame compose() {
        ViewState view = liveView.get().copy();
        TileTier baseTier = lodPolicy.baseTier();
        TileTier activeTier = lodPolicy.activeTier(view.getScale());

        TierTiles base = collect(view, baseTier);
        TierTiles detail = activeTier.equals(baseTier) ? new TierTiles() : collect(view, activeTier);

        FieldGrid grid = fieldOverlayEnabled ? fieldSampleCache.ensureCurrent(view) : null;
        DatasetResolution resolution = datasetLodSwitch.getState();

        return GlobeFrame.builder()
                .frameNumber(++frameNumber)
                .view(view)
                .baseTier(baseTier)
                .activeTier(activeTier)
                .baseTiles(List.copyOf(base.loaded))
                .detailTiles(List.copyOf(detail.loaded))
                .pendingTiles(base.pending + detail.pending)
                .failedTiles(base.failed + detail.failed)
                .fieldGrid(grid)
                .datasetResolution(resolution)
                .surfaceGeometry(surfaceDatasets.select(resolution))
                .loaderStats(tileManager.getStats())
                .build();
    }

    private TierTiles collect(ViewState view, TileTier tier) {
        TierTiles tiles = new TierTiles();
        for (TileDescriptor descriptor : visibilityCalculator.visibleTiles(view, tier)) {
            TileRecord record = tileManager.requestTile(descriptor).getRecord();
            TileStatus status = record.getStatus();
            if (status == TileStatus.LOADED) {
                tiles.loaded.add(record);
            } else if (status == TileStatus.PENDING) {
                tiles.pending++;
            } else {
                tiles.failed++;
            }
        }
        return tiles;
    }

    private static class TierTiles {
        private final List<TileRecord> loaded = new ArrayList<>();
        private int pending;
        private int failed;
    }
}
