package com.gaia3d.util;

import lombok.Getter;

/**
 * Reference bodies with their ellipsoid constants.
 * The geomagnetic model and the geodetic helpers in {@link GlobeUtils} read their radii from here.
 */
@Getter
public enum CelestialBody {
    /**
     * Earth - WGS84 ellipsoid model
     */
    EARTH(
        "Earth",
        6378137.0,           // Equatorial radius in meters
        6356752.314245,      // Polar radius in meters
        1.0 / 298.257223563, // Flattening
        6.69437999014E-3,    // First eccentricity squared
        6371200.0            // Geomagnetic reference radius in meters
    ),

    /**
     * Earth as a sphere of the geomagnetic reference radius.
     * Used where the orthographic globe is treated as a perfect sphere.
     */
    EARTH_SPHERE(
        "Earth (sphere)",
        6371200.0,
        6371200.0,
        0.0,
        0.0,
        6371200.0
    );

    private final String name;
    private final double equatorialRadius;
    private final double polarRadius;
    private final double flattening;
    private final double firstEccentricitySquared;
    private final double referenceRadius;

    /**
     * Constructor for CelestialBody enum.
     *
     * @param name Display name of the body
     * @param equatorialRadius Equatorial radius in meters
     * @param polarRadius Polar radius in meters
     * @param flattening Flattening (0 for sphere)
     * @param firstEccentricitySquared First eccentricity squared (0 for sphere)
     * @param referenceRadius Mean reference radius used by spherical harmonic models, in meters
     */
    CelestialBody(String name, double equatorialRadius, double polarRadius, double flattening,
                  double firstEccentricitySquared, double referenceRadius) {
        this.name = name;
        this.equatorialRadius = equatorialRadius;
        this.polarRadius = polarRadius;
        this.flattening = flattening;
        this.firstEccentricitySquared = firstEccentricitySquared;
        this.referenceRadius = referenceRadius;
    }

    public double getEquatorialRadiusSquared() {
        return equatorialRadius * equatorialRadius;
    }

    public double getPolarRadiusSquared() {
        return polarRadius * polarRadius;
    }

    /**
     * Ratio of polar to equatorial radius, used to draw the flattened globe outline.
     */
    public double getAxisRatio() {
        return polarRadius / equatorialRadius;
    }

    public boolean isSphere() {
        return firstEccentricitySquared == 0.0;
    }

    /**
     * Parse a body from a string value.
     * Case-insensitive matching, '-' and ' ' are accepted in place of '_'.
     *
     * @param value String representation of the body ("earth" or "earth_sphere")
     * @return CelestialBody enum constant
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static CelestialBody fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Celestial body value cannot be null or empty");
        }

        String normalized = value.trim().toUpperCase().replace('-', '_').replace(' ', '_');

        try {
            return CelestialBody.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                String.format("Unknown celestial body: '%s'. Valid values are: earth, earth_sphere", value)
            );
        }
    }
}
