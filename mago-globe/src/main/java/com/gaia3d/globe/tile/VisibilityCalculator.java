package com.gaia3d.globe.tile;

import com.gaia3d.globe.projection.ProjectedPoint;
import com.gaia3d.globe.projection.Projection;
import com.gaia3d.globe.projection.ProjectionFactory;
import com.gaia3d.globe.view.ViewState;
import org.joml.Vector2dc;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the tiles of a tier whose center lies on the visible face of the globe.
 * Only the center is sampled, so tiles straddling the horizon may appear late.
 */
public class VisibilityCalculator {
    private static final double EPSILON = 1e-9;

    private final ProjectionFactory projectionFactory;

    public VisibilityCalculator(ProjectionFactory projectionFactory) {
        this.projectionFactory = projectionFactory;
    }

    /**
     * @return visible tiles ordered by longitude then latitude, possibly empty
     */
    public Set<TileDescriptor> visibleTiles(ViewState view, TileTier tier) {
        Projection projection = projectionFactory.create(view);
        Vector2dc center = projection.getTranslate();
        double radius = projection.getScale();
        int size = (int) tier.getTileSizeDegrees();

        int columns = (int) Math.ceil(360.0 / size - EPSILON);
        int rows = (int) Math.ceil(180.0 / size - EPSILON);

        Set<TileDescriptor> visible = new LinkedHashSet<>();
        for (int column = 0; column < columns; column++) {
            int lon = -180 + column * size;
            for (int row = 0; row < rows; row++) {
                int lat = -90 + row * size;
                Optional<ProjectedPoint> projected = projection.project(lon + size / 2.0, lat + size / 2.0);
                if (projected.isEmpty()) {
                    continue;
                }
                ProjectedPoint point = projected.get();
                if (center.distance(point.getX(), point.getY()) <= radius + EPSILON) {
                    visible.add(new TileDescriptor(tier, lon, lat));
                }
            }
        }
        return Collections.unmodifiableSet(visible);
    }
}
