package com.gaia3d.globe;

import com.gaia3d.globe.command.GlobalOptions;
import com.gaia3d.globe.render.DatasetResolution;
import com.gaia3d.globe.render.GlobeFrame;
import com.gaia3d.globe.render.LoggingFrameRenderer;
import com.gaia3d.globe.support.GeoJsonFixtures;
import com.gaia3d.globe.support.ManualEventLoop;
import com.gaia3d.globe.support.ManualTileSource;
import com.gaia3d.globe.tile.TileDescriptor;
import com.gaia3d.globe.tile.TileTier;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class GlobeSessionTest {

    private ManualEventLoop loop;
    private ManualTileSource source;
    private LoggingFrameRenderer renderer;
    private GlobalOptions options;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        source = new ManualTileSource();
        renderer = new LoggingFrameRenderer();
        options = new GlobalOptions();
        options.setInput("memory");
        options.setDecimalYear(2025.0);
    }

    private GlobeSession session(boolean withFieldModel) {
        return new GlobeSession(options, loop, source, withFieldModel ? (latitude, longitude) -> 1.5 : null, renderer);
    }

    private Set<TileDescriptor> visible(GlobeSession session, TileTier tier) {
        return session.getVisibilityCalculator().visibleTiles(session.getViewState().copy(), tier);
    }

    /**
     * Answers every fetch and draws until nothing is outstanding and no frame is pending.
     */
    private void settle(GlobeSession session) {
        for (int i = 0; i < 10_000; i++) {
            loop.runFrame();
            if (source.getOutstanding().isEmpty()) {
                if (!session.getRenderScheduler().isFramePending()) {
                    return;
                }
                continue;
            }
            source.completeAll(GeoJsonFixtures.SQUARE_ISLAND);
            loop.runPending();
        }
        fail("Session did not settle");
    }

    @Test
    void testFirstFrameRequestsVisibleBaseTiles() {
        GlobeSession session = session(true);
        session.start();
        loop.runPending();

        assertTrue(source.isOutstanding("land_110m.json"));
        assertTrue(source.isOutstanding("land_50m.json"));
        assertTrue(session.getRenderScheduler().isFramePending());

        loop.runFrame();
        TileTier baseTier = session.getLodPolicy().baseTier();
        int visibleCount = visible(session, baseTier).size();
        GlobeFrame frame = renderer.getLastFrame();

        assertNotNull(frame);
        assertEquals(baseTier, frame.getActiveTier());
        assertFalse(frame.hasDetailLayer());
        assertEquals(visibleCount, frame.getPendingTiles());
        assertTrue(frame.getBaseTiles().isEmpty());
        assertEquals(2 + Math.min(visibleCount, options.getMaxConcurrentFetches()), source.getRequestCount());
        assertNotNull(frame.getFieldGrid());
        assertTrue(frame.getFieldGrid().isHighDetail());
        assertFalse(session.isIdle());
    }

    @Test
    void testSessionBecomesIdleOnceEverythingArrived() {
        GlobeSession session = session(true);
        session.start();
        loop.runPending();
        settle(session);

        TileTier baseTier = session.getLodPolicy().baseTier();
        int visibleCount = visible(session, baseTier).size();
        GlobeFrame frame = renderer.getLastFrame();
        assertEquals(visibleCount, frame.getBaseTiles().size());
        assertEquals(0, frame.getPendingTiles());
        assertEquals(0, frame.getFailedTiles());
        assertTrue(session.getSurfaceDatasets().isAvailable(DatasetResolution.HIGH));
        assertEquals(DatasetResolution.LOW, frame.getDatasetResolution());
        assertFalse(frame.getSurfaceGeometry().isEmpty());
        assertTrue(session.isIdle());

        Map<String, int[]> counts = session.tileCountsByTier();
        assertArrayEquals(new int[]{visibleCount, 0, 0}, counts.get(baseTier.getName()));
        assertEquals(3, counts.size());
    }

    @Test
    void testZoomAddsDetailTierAndUpgradesDataset() {
        GlobeSession session = session(true);
        session.start();
        loop.runPending();
        settle(session);

        session.getInteractionController().setScale(700);
        settle(session);

        GlobeFrame frame = renderer.getLastFrame();
        assertEquals("10m", frame.getActiveTier().getName());
        assertTrue(frame.hasDetailLayer());
        assertEquals(visible(session, frame.getActiveTier()).size(), frame.getDetailTiles().size());
        assertEquals(DatasetResolution.LOW, frame.getDatasetResolution());
        assertTrue(session.getDatasetLodSwitch().isUpgradePending());

        loop.advance(options.getLodDelayMillis());
        loop.runFrame();
        frame = renderer.getLastFrame();
        assertEquals(DatasetResolution.HIGH, frame.getDatasetResolution());
        assertSame(session.getSurfaceDatasets().select(DatasetResolution.HIGH), frame.getSurfaceGeometry());

        session.getInteractionController().beginInteraction();
        assertEquals(DatasetResolution.LOW, session.getDatasetLodSwitch().getState());
    }

    @Test
    void testFailedTilesAndDatasetsDegradeGracefully() {
        GlobeSession session = session(false);
        session.start();
        loop.runPending();
        loop.runFrame();

        TileTier baseTier = session.getLodPolicy().baseTier();
        TileDescriptor first = visible(session, baseTier).iterator().next();
        source.fail(first, "HTTP 404");
        source.fail("land_50m.json", "HTTP 404");
        loop.runPending();
        settle(session);

        int visibleCount = visible(session, baseTier).size();
        GlobeFrame frame = renderer.getLastFrame();
        assertEquals(1, frame.getFailedTiles());
        assertEquals(visibleCount - 1, frame.getBaseTiles().size());
        assertNull(frame.getFieldGrid());
        assertArrayEquals(new int[]{visibleCount - 1, 1, 0}, session.tileCountsByTier().get(baseTier.getName()));

        assertFalse(session.getSurfaceDatasets().isAvailable(DatasetResolution.HIGH));
        assertFalse(session.getDatasetLodSwitch().isHighResAvailable());
        assertSame(session.getSurfaceDatasets().select(DatasetResolution.LOW),
                session.getSurfaceDatasets().select(DatasetResolution.HIGH));
        assertTrue(session.isIdle());
        assertEquals(1, source.countRequests(source.nameOf(first)));
    }

    @Test
    void testCallRunsOnTheLoop() {
        GlobeSession session = session(false);
        CompletableFuture<Integer> result = session.call(() -> 42);
        assertFalse(result.isDone());
        loop.runPending();
        assertEquals(42, result.join());

        CompletableFuture<Object> failing = session.call(() -> {
            throw new IllegalStateException("boom");
        });
        loop.runPending();
        assertTrue(failing.isCompletedExceptionally());
    }

    @Test
    void testTileAtPointFollowsTheActiveTier() {
        GlobeSession session = session(false);

        // view center is (0, -10) at the default pitch
        assertEquals("110m/0/-18", session.tileAtPoint(480, 360).orElseThrow().getId());
        assertTrue(session.tileAtPoint(0, 0).isEmpty());

        session.getInteractionController().setScale(700);
        assertEquals("10m/0/-12", session.tileAtPoint(480, 360).orElseThrow().getId());
    }
}
