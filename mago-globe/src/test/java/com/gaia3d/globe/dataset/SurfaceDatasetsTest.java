package com.gaia3d.globe.dataset;

import com.gaia3d.globe.render.DatasetResolution;
import com.gaia3d.globe.support.GeoJsonFixtures;
import com.gaia3d.globe.support.ManualEventLoop;
import com.gaia3d.globe.support.ManualTileSource;
import com.gaia3d.globe.tile.source.TileGeometryParser;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class SurfaceDatasetsTest {

    @Test
    void testBothDatasetsLoad() {
        ManualEventLoop loop = new ManualEventLoop();
        ManualTileSource source = new ManualTileSource();
        SurfaceDatasets datasets = new SurfaceDatasets(loop, source, new TileGeometryParser(),
                SurfaceDatasets.DEFAULT_LOW_RES, SurfaceDatasets.DEFAULT_HIGH_RES);
        List<String> events = new ArrayList<>();
        datasets.setAvailabilityListener((resolution, available) -> events.add(resolution + ":" + available));

        assertTrue(datasets.select(DatasetResolution.LOW).isEmpty());
        CompletableFuture<Void> loaded = datasets.load();
        source.complete("land_50m.json", GeoJsonFixtures.TWO_ISLANDS);
        loop.runPending();
        assertFalse(loaded.isDone());
        assertTrue(datasets.isAvailable(DatasetResolution.HIGH));
        // only the high resolution one so far
        assertEquals(2, datasets.select(DatasetResolution.LOW).getNumGeometries());

        source.complete("land_110m.json", GeoJsonFixtures.SQUARE_ISLAND);
        loop.runPending();
        assertTrue(loaded.isDone());
        assertEquals(List.of("HIGH:true", "LOW:true"), events);
        assertEquals(1, datasets.select(DatasetResolution.LOW).getNumGeometries());
        assertEquals(2, datasets.select(DatasetResolution.HIGH).getNumGeometries());
    }

    @Test
    void testFailureLeavesDatasetUnavailable() {
        ManualEventLoop loop = new ManualEventLoop();
        ManualTileSource source = new ManualTileSource();
        SurfaceDatasets datasets = new SurfaceDatasets(loop, source, new TileGeometryParser(), "low.json", "high.json");
        List<String> events = new ArrayList<>();
        datasets.setAvailabilityListener((resolution, available) -> events.add(resolution + ":" + available));

        CompletableFuture<Void> loaded = datasets.load();
        source.complete("low.json", GeoJsonFixtures.NOT_JSON);
        source.fail("high.json", "HTTP 500");
        loop.runPending();

        assertTrue(loaded.isDone());
        assertFalse(datasets.isAvailable(DatasetResolution.LOW));
        assertFalse(datasets.isAvailable(DatasetResolution.HIGH));
        assertTrue(datasets.select(DatasetResolution.HIGH).isEmpty());
        assertEquals(List.of("LOW:false", "HIGH:false"), events);
    }

    @Test
    void testMissingHighResolutionNameIsSkipped() {
        ManualEventLoop loop = new ManualEventLoop();
        ManualTileSource source = new ManualTileSource();
        SurfaceDatasets datasets = new SurfaceDatasets(loop, source, new TileGeometryParser(), "low.json", null);

        CompletableFuture<Void> loaded = datasets.load();
        assertEquals(List.of("low.json"), source.getRequests());
        source.complete("low.json", GeoJsonFixtures.SQUARE_ISLAND);
        loop.runPending();
        assertTrue(loaded.isDone());
        assertFalse(datasets.isAvailable(DatasetResolution.HIGH));
    }
}
