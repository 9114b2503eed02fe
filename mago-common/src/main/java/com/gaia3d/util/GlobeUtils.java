package com.gaia3d.util;

import org.joml.Vector3d;

/**
 * Geodetic helpers on a {@link CelestialBody} ellipsoid.
 */
public class GlobeUtils {

    private GlobeUtils() {
    }

    /**
     * Geodetic longitude/latitude/altitude to earth-centered cartesian coordinates.
     *
     * @param lonDeg longitude in degrees
     * @param latDeg latitude in degrees
     * @param altitude altitude above the ellipsoid in meters
     * @param body reference body
     * @return x, y, z in meters
     */
    public static double[] geographicToCartesian(double lonDeg, double latDeg, double altitude, CelestialBody body) {
        double lonRad = Math.toRadians(lonDeg);
        double latRad = Math.toRadians(latDeg);
        double cosLon = Math.cos(lonRad);
        double sinLon = Math.sin(lonRad);
        double cosLat = Math.cos(latRad);
        double sinLat = Math.sin(latRad);

        double e2 = body.getFirstEccentricitySquared();
        double v = body.getEquatorialRadius() / Math.sqrt(1.0 - e2 * sinLat * sinLat);

        double[] result = new double[3];
        result[0] = (v + altitude) * cosLat * cosLon;
        result[1] = (v + altitude) * cosLat * sinLon;
        result[2] = (v * (1.0 - e2) + altitude) * sinLat;
        return result;
    }

    public static double[] geographicToCartesianWgs84(double lonDeg, double latDeg, double altitude) {
        return geographicToCartesian(lonDeg, latDeg, altitude, CelestialBody.EARTH);
    }

    /**
     * Converts a geodetic position into geocentric spherical coordinates.
     * The result holds the geocentric latitude in radians (x), longitude in radians (y)
     * and the distance to the body center in meters (z).
     */
    public static Vector3d geodeticToGeocentric(double lonDeg, double latDeg, double altitude, CelestialBody body) {
        double a2 = body.getEquatorialRadiusSquared();
        double b2 = body.getPolarRadiusSquared();
        double latRad = Math.toRadians(latDeg);
        double cosLat = Math.cos(latRad);
        double sinLat = Math.sin(latRad);

        double rho = Math.sqrt(a2 * cosLat * cosLat + b2 * sinLat * sinLat);
        double geocentricLat = Math.atan2((rho * altitude + b2) * sinLat, (rho * altitude + a2) * cosLat);
        double radiusSquared = altitude * altitude
                + 2.0 * altitude * rho
                + (a2 * a2 * cosLat * cosLat + b2 * b2 * sinLat * sinLat) / (a2 * cosLat * cosLat + b2 * sinLat * sinLat);

        return new Vector3d(geocentricLat, Math.toRadians(lonDeg), Math.sqrt(radiusSquared));
    }

    /**
     * Prime vertical radius of curvature at the given latitude.
     */
    public static double getRadiusAtLatitude(double latDeg, CelestialBody body) {
        double sinLat = Math.sin(Math.toRadians(latDeg));
        return body.getEquatorialRadius() / Math.sqrt(1.0 - body.getFirstEccentricitySquared() * sinLat * sinLat);
    }

    /**
     * Wraps a longitude into [-180, 180).
     */
    public static double normalizeLongitude(double lonDeg) {
        double wrapped = ((lonDeg + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
        return wrapped == 180.0 ? -180.0 : wrapped;
    }

    public static double clampLatitude(double latDeg) {
        return Math.max(-90.0, Math.min(90.0, latDeg));
    }
}
