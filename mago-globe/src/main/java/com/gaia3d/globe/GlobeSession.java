package com.gaia3d.globe;

import com.gaia3d.globe.command.GlobalOptions;
import com.gaia3d.globe.dataset.SurfaceDatasets;
import com.gaia3d.globe.field.FieldEvaluationException;
import com.gaia3d.globe.field.FieldGrid;
import com.gaia3d.globe.field.FieldModel;
import com.gaia3d.globe.field.FieldSampleCache;
import com.gaia3d.globe.field.wmm.WorldMagneticModel;
import com.gaia3d.globe.projection.ProjectionFactory;
import com.gaia3d.globe.render.DatasetLodSwitch;
import com.gaia3d.globe.render.DatasetResolution;
import com.gaia3d.globe.render.FrameRenderer;
import com.gaia3d.globe.render.GlobeFrameComposer;
import com.gaia3d.globe.render.LoggingFrameRenderer;
import com.gaia3d.globe.render.RenderScheduler;
import com.gaia3d.globe.scheduler.EventLoop;
import com.gaia3d.globe.scheduler.SingleThreadEventLoop;
import com.gaia3d.globe.tile.BoundedTileLoader;
import com.gaia3d.globe.tile.LodPolicy;
import com.gaia3d.globe.tile.LruTileEvictionPolicy;
import com.gaia3d.globe.tile.TileCache;
import com.gaia3d.globe.tile.TileDescriptor;
import com.gaia3d.globe.tile.TileEvictionPolicy;
import com.gaia3d.globe.tile.TileKeys;
import com.gaia3d.globe.tile.TileLoaderStats;
import com.gaia3d.globe.tile.TileManager;
import com.gaia3d.globe.tile.TileRecord;
import com.gaia3d.globe.tile.TileStatus;
import com.gaia3d.globe.tile.TileTier;
import com.gaia3d.globe.tile.VisibilityCalculator;
import com.gaia3d.globe.tile.source.FileTileSource;
import com.gaia3d.globe.tile.source.HttpTileSource;
import com.gaia3d.globe.tile.source.TileGeometryParser;
import com.gaia3d.globe.tile.source.TileNameTemplate;
import com.gaia3d.globe.tile.source.TileSource;
import com.gaia3d.globe.view.InteractionController;
import com.gaia3d.globe.view.ViewState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Owns and wires every component of one globe view. Nothing here is a singleton; tests build
 * sessions on a manual event loop and an in-memory tile source.
 * Components must be used on the event loop thread; {@link #call(Supplier)} gets there from elsewhere.
 */
@Slf4j
@Getter
public class GlobeSession implements AutoCloseable {
    private final GlobalOptions options;
    private final EventLoop eventLoop;
    private final TileSource tileSource;
    private final ViewState viewState;
    private final RenderScheduler renderScheduler;
    private final LodPolicy lodPolicy;
    private final VisibilityCalculator visibilityCalculator;
    private final TileManager tileManager;
    private final FieldSampleCache fieldSampleCache;
    private final DatasetLodSwitch datasetLodSwitch;
    private final SurfaceDatasets surfaceDatasets;
    private final GlobeFrameComposer frameComposer;
    private final InteractionController interactionController;
    @Getter(AccessLevel.NONE)
    private volatile CompletableFuture<Void> datasetLoad;

    /**
     * @param fieldModel declination model, or null to run without the overlay
     */
    public GlobeSession(GlobalOptions options, EventLoop eventLoop, TileSource tileSource,
                        FieldModel fieldModel, FrameRenderer frameRenderer) {
        this.options = options;
        this.eventLoop = eventLoop;
        this.tileSource = tileSource;
        this.viewState = new ViewState(options.getScale(), options.getYaw(), options.getPitch(), options.getRoll());

        ProjectionFactory projectionFactory = ProjectionFactory.orthographic(options.getViewportWidth(), options.getViewportHeight());
        TileGeometryParser parser = new TileGeometryParser();

        this.renderScheduler = new RenderScheduler(eventLoop);
        this.lodPolicy = new LodPolicy(options.getTiers());
        this.visibilityCalculator = new VisibilityCalculator(projectionFactory);

        TileEvictionPolicy evictionPolicy = options.getTileCacheSize() > 0
                ? new LruTileEvictionPolicy(options.getTileCacheSize())
                : TileEvictionPolicy.none();
        BoundedTileLoader loader = new BoundedTileLoader(eventLoop, tileSource, parser, options.getMaxConcurrentFetches());
        this.tileManager = new TileManager(new TileCache(evictionPolicy), loader, renderScheduler::scheduleRedraw);

        FieldModel model = fieldModel != null ? fieldModel : (latitude, longitude) -> {
            throw new FieldEvaluationException("No field model loaded");
        };
        this.fieldSampleCache = new FieldSampleCache(eventLoop, () -> viewState, model,
                options.getFieldModelParameters(), options.getFieldResolution());
        this.fieldSampleCache.setOnGridUpdated(renderScheduler::scheduleRedraw);

        this.datasetLodSwitch = new DatasetLodSwitch(eventLoop, options.getLodThresholdScale(),
                options.getLodDelayMillis(), renderScheduler::scheduleRedraw);
        this.surfaceDatasets = new SurfaceDatasets(eventLoop, tileSource, parser,
                options.getLowResDataset(), options.getHighResDataset());
        this.surfaceDatasets.setAvailabilityListener((resolution, available) -> {
            if (resolution == DatasetResolution.HIGH) {
                datasetLodSwitch.setHighResAvailable(available);
            }
            renderScheduler.scheduleRedraw();
        });

        this.frameComposer = new GlobeFrameComposer(() -> viewState, visibilityCalculator, lodPolicy, tileManager,
                fieldSampleCache, datasetLodSwitch, surfaceDatasets, frameRenderer);
        this.frameComposer.setFieldOverlayEnabled(fieldModel != null);
        this.renderScheduler.setDrawPass(frameComposer);

        this.interactionController = new InteractionController(viewState, projectionFactory, fieldSampleCache,
                datasetLodSwitch, renderScheduler, options.getMinScale(), options.getMaxScale(), options.getSensitivity());
    }

    /**
     * Session with a real event loop, the tile source and model named by the options,
     * and a logging renderer.
     */
    public static GlobeSession create(GlobalOptions options) throws IOException {
        TileNameTemplate template = new TileNameTemplate(options.getTileTemplate());
        TileSource source = options.isRemoteInput()
                ? new HttpTileSource(URI.create(options.getInput()), template)
                : new FileTileSource(Paths.get(options.getInput()), template);

        FieldModel fieldModel = null;
        if (options.getCofPath() != null) {
            WorldMagneticModel wmm = WorldMagneticModel.load(options.getCofPath()).onBody(options.getCelestialBody());
            fieldModel = wmm.declinationModel(options.getFieldModelParameters());
        } else {
            log.info("[Session] no coefficient file given, declination overlay disabled.");
        }
        return new GlobeSession(options, new SingleThreadEventLoop(), source, fieldModel, new LoggingFrameRenderer());
    }

    /**
     * Starts the dataset loads and the first frame.
     */
    public void start() {
        eventLoop.execute(() -> {
            log.info("[Session] starting at {}", viewState);
            datasetLodSwitch.update(viewState.getScale(), interactionController.isInteracting());
            datasetLoad = surfaceDatasets.load();
            renderScheduler.scheduleRedraw();
        });
    }

    /**
     * Runs the supplier on the event loop thread.
     */
    public <T> CompletableFuture<T> call(Supplier<T> supplier) {
        CompletableFuture<T> future = new CompletableFuture<>();
        eventLoop.execute(() -> {
            try {
                future.complete(supplier.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * True once the datasets settled, a frame was drawn, no tile is queued or in flight and no frame is pending.
     */
    public boolean isIdle() {
        CompletableFuture<Void> datasets = datasetLoad;
        TileLoaderStats stats = tileManager.getStats();
        return datasets != null && datasets.isDone()
                && renderScheduler.getFrameCount() > 0 && stats.isIdle() && !renderScheduler.isFramePending();
    }

    /**
     * Waits for {@link #isIdle()} by polling.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!isIdle()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(50);
        }
        return true;
    }

    /**
     * Loaded, failed and pending tile counts per tier name, in tier order.
     */
    public Map<String, int[]> tileCountsByTier() {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (TileTier tier : lodPolicy.getTiers()) {
            counts.put(tier.getName(), new int[3]);
        }
        for (TileRecord record : tileManager.getCache().getRecords()) {
            int[] tierCounts = counts.computeIfAbsent(record.getDescriptor().getTier().getName(), name -> new int[3]);
            TileStatus status = record.getStatus();
            tierCounts[status == TileStatus.LOADED ? 0 : status == TileStatus.FAILED ? 1 : 2]++;
        }
        return counts;
    }

    /**
     * Tile of the active tier under a screen point, empty off the globe.
     */
    public Optional<TileDescriptor> tileAtPoint(double screenX, double screenY) {
        TileTier tier = lodPolicy.activeTier(viewState.getScale());
        return interactionController.coordsAtPoint(screenX, screenY)
                .map(lonLat -> TileKeys.descriptorAt(tier, lonLat.x, lonLat.y));
    }

    public FieldGrid getCurrentFieldGrid() {
        return fieldSampleCache.getCurrent();
    }

    @Override
    public void close() {
        if (eventLoop instanceof AutoCloseable) {
            closeQuietly((AutoCloseable) eventLoop);
        }
        if (tileSource instanceof AutoCloseable) {
            closeQuietly((AutoCloseable) tileSource);
        }
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("[Session] failed to close {}", closeable.getClass().getSimpleName(), e);
        }
    }
}
