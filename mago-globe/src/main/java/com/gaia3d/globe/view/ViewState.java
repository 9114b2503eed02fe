package com.gaia3d.globe.view;

import lombok.Getter;
import org.joml.Vector3d;
import org.joml.Vector3dc;

/**
 * Camera state of the globe: orthographic scale (globe radius in pixels) and rotation
 * angles in degrees as yaw (lambda), pitch (phi) and roll (gamma).
 * Only {@link InteractionController} writes the live instance; the caches keep {@link #copy()} snapshots.
 */
@Getter
public class ViewState {
    private final Vector3d rotation = new Vector3d();
    private double scale;

    public ViewState(double scale, double yaw, double pitch, double roll) {
        setScale(scale);
        setRotation(yaw, pitch, roll);
    }

    public ViewState(double scale, double yaw, double pitch) {
        this(scale, yaw, pitch, 0.0);
    }

    public Vector3dc getRotation() {
        return rotation;
    }

    public double getYaw() {
        return rotation.x;
    }

    public double getPitch() {
        return rotation.y;
    }

    public double getRoll() {
        return rotation.z;
    }

    void setScale(double scale) {
        if (!Double.isFinite(scale) || scale <= 0) {
            throw new IllegalArgumentException("Scale must be a positive finite value: " + scale);
        }
        this.scale = scale;
    }

    void setRotation(double yaw, double pitch, double roll) {
        if (!Double.isFinite(yaw) || !Double.isFinite(pitch) || !Double.isFinite(roll)) {
            throw new IllegalArgumentException("Rotation angles must be finite");
        }
        this.rotation.set(yaw, pitch, roll);
    }

    public ViewState copy() {
        return new ViewState(scale, rotation.x, rotation.y, rotation.z);
    }

    @Override
    public String toString() {
        return String.format("ViewState[scale=%.1f, rotation=(%.2f, %.2f, %.2f)]", scale, rotation.x, rotation.y, rotation.z);
    }
}
