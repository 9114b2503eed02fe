package com.gaia3d.globe.projection;

import com.gaia3d.globe.view.ViewState;

/**
 * Builds the projection matching a view snapshot.
 */
@FunctionalInterface
public interface ProjectionFactory {

    Projection create(ViewState view);

    /**
     * Orthographic projection centered in a viewport of the given size.
     */
    static ProjectionFactory orthographic(double viewportWidth, double viewportHeight) {
        return view -> OrthographicProjection.forView(view, viewportWidth, viewportHeight);
    }
}
