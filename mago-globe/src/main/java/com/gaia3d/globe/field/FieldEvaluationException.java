package com.gaia3d.globe.field;

/**
 * The field is undefined at the requested point, e.g. declination at a geographic pole.
 */
public class FieldEvaluationException extends Exception {

    public FieldEvaluationException(String message) {
        super(message);
    }
}
