package com.gaia3d.globe.projection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Screen position of a geographic point. {@code visibility} is the cosine of the angular
 * distance to the view center: 1 at the center of the globe face, 0 on the horizon.
 */
@Getter
@ToString
@AllArgsConstructor
public class ProjectedPoint {
    private final double x;
    private final double y;
    private final double visibility;
}
