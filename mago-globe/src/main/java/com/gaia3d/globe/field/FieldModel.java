package com.gaia3d.globe.field;

/**
 * Scalar field over the sphere, sampled by {@link FieldSampleCache}.
 */
@FunctionalInterface
public interface FieldModel {

    /**
     * @param latitude  geodetic latitude in degrees
     * @param longitude longitude in degrees
     * @return the field value, declination in degrees for the magnetic model
     * @throws FieldEvaluationException if the field is undefined at that point
     */
    double evaluate(double latitude, double longitude) throws FieldEvaluationException;
}
