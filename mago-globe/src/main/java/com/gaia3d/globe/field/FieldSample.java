package com.gaia3d.globe.field;

import lombok.Getter;
import lombok.ToString;

/**
 * One evaluated grid point. The sine and cosine of the value are kept for drawing direction arrows.
 */
@Getter
@ToString
public class FieldSample {
    private final double latitude;
    private final double longitude;
    private final double value;
    private final double sin;
    private final double cos;

    public FieldSample(double latitude, double longitude, double value) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.value = value;
        double radians = Math.toRadians(value);
        this.sin = Math.sin(radians);
        this.cos = Math.cos(radians);
    }
}
