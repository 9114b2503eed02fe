package com.gaia3d.globe.projection;

import org.joml.Vector2d;
import org.joml.Vector2dc;

import java.util.Optional;

public interface Projection {

    /**
     * @return the screen point, or empty when the point lies on the clipped (back) side of the globe
     */
    Optional<ProjectedPoint> project(double lonDeg, double latDeg);

    /**
     * @return longitude (x) and latitude (y) in degrees, or empty when the screen point is off the globe
     */
    Optional<Vector2d> invert(double screenX, double screenY);

    double getScale();

    /**
     * Screen position of the globe center.
     */
    Vector2dc getTranslate();
}
