package com.gaia3d.globe.view;

import com.gaia3d.globe.field.FieldSampleCache;
import com.gaia3d.globe.projection.ProjectionFactory;
import com.gaia3d.globe.render.DatasetLodSwitch;
import com.gaia3d.globe.render.RenderScheduler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.joml.Vector2d;
import org.joml.Vector3d;

import java.util.Optional;

/**
 * The only writer of the live {@link ViewState}. Translates pointer gestures into rotation and scale
 * and tells the caches and the render scheduler after every change.
 * Must be called on the event loop thread.
 */
@Slf4j
public class InteractionController {
    public static final double ZOOM_FACTOR = 1.15;
    public static final double MIN_SCALE_CHANGE = 0.01;
    public static final double DEFAULT_MIN_SCALE = 150.0;
    public static final double DEFAULT_MAX_SCALE = 1200.0;
    public static final double DEFAULT_SENSITIVITY = 75.0;

    private final ViewState view;
    private final ProjectionFactory projectionFactory;
    private final FieldSampleCache fieldSampleCache;
    private final DatasetLodSwitch datasetLodSwitch;
    private final RenderScheduler renderScheduler;
    @Getter
    private final double minScale;
    @Getter
    private final double maxScale;
    @Getter
    private final double sensitivity;

    @Getter
    private boolean interacting = false;
    private Vector3d dragStartRotation;

    public InteractionController(ViewState view, ProjectionFactory projectionFactory, FieldSampleCache fieldSampleCache,
                                 DatasetLodSwitch datasetLodSwitch, RenderScheduler renderScheduler) {
        this(view, projectionFactory, fieldSampleCache, datasetLodSwitch, renderScheduler,
                DEFAULT_MIN_SCALE, DEFAULT_MAX_SCALE, DEFAULT_SENSITIVITY);
    }

    public InteractionController(ViewState view, ProjectionFactory projectionFactory, FieldSampleCache fieldSampleCache,
                                 DatasetLodSwitch datasetLodSwitch, RenderScheduler renderScheduler,
                                 double minScale, double maxScale, double sensitivity) {
        if (!(minScale > 0) || maxScale < minScale) {
            throw new IllegalArgumentException(String.format("Invalid scale range [%s, %s]", minScale, maxScale));
        }
        this.view = view;
        this.projectionFactory = projectionFactory;
        this.fieldSampleCache = fieldSampleCache;
        this.datasetLodSwitch = datasetLodSwitch;
        this.renderScheduler = renderScheduler;
        this.minScale = minScale;
        this.maxScale = maxScale;
        this.sensitivity = sensitivity;
    }

    /**
     * Pointer pressed: drags are measured from the rotation at this moment.
     */
    public void beginInteraction() {
        interacting = true;
        dragStartRotation = new Vector3d(view.getRotation());
        datasetLodSwitch.update(view.getScale(), true);
    }

    /**
     * Mouse drag by the total pixel offset since {@link #beginInteraction()}.
     * One screen pixel turns the globe by the angle it spans at the current radius.
     */
    public void drag(double dx, double dy) {
        Vector3d start = requireDragStart();
        double degPerPixel = 360.0 / (2.0 * Math.PI * view.getScale());
        applyRotation(start.x + dx * degPerPixel, start.y + dy * degPerPixel, start.z);
    }

    /**
     * Single finger drag, damped by the sensitivity and inverted vertically.
     */
    public void touchDrag(double dx, double dy) {
        Vector3d start = requireDragStart();
        double sensitivityFactor = 1.0 / (view.getScale() * 0.015);
        double effective = Math.max(0.05, Math.min(1.0, sensitivity * sensitivityFactor));
        applyRotation(start.x + dx * effective, start.y - dy * effective, start.z);
    }

    /**
     * Wheel zoom: one notch scales by {@value #ZOOM_FACTOR}, in when the delta is negative.
     *
     * @return false when the change was too small to apply, typically at the scale limits
     */
    public boolean zoom(double wheelDeltaY) {
        double factor = wheelDeltaY < 0 ? ZOOM_FACTOR : 1.0 / ZOOM_FACTOR;
        double newScale = clampScale(view.getScale() * factor);
        if (Math.abs(newScale - view.getScale()) <= MIN_SCALE_CHANGE) {
            return false;
        }
        view.setScale(newScale);
        viewChanged();
        return true;
    }

    /**
     * Pointer released: the view is final, so the dataset switch may upgrade and a frame is forced.
     */
    public void endInteraction() {
        interacting = false;
        dragStartRotation = null;
        viewChanged();
    }

    public void setRotation(double yaw, double pitch, double roll) {
        applyRotation(yaw, pitch, roll);
    }

    public void setScale(double scale) {
        if (!Double.isFinite(scale) || scale <= 0) {
            throw new IllegalArgumentException("Scale must be a positive finite value: " + scale);
        }
        view.setScale(clampScale(scale));
        viewChanged();
    }

    /**
     * Geographic position under a screen point, empty when the point is off the globe.
     */
    public Optional<Vector2d> coordsAtPoint(double screenX, double screenY) {
        return projectionFactory.create(view).invert(screenX, screenY);
    }

    public ViewState getView() {
        return view.copy();
    }

    private Vector3d requireDragStart() {
        if (dragStartRotation == null) {
            beginInteraction();
        }
        return dragStartRotation;
    }

    private void applyRotation(double yaw, double pitch, double roll) {
        view.setRotation(yaw, Math.max(-90.0, Math.min(90.0, pitch)), roll);
        viewChanged();
    }

    private double clampScale(double scale) {
        return Math.max(minScale, Math.min(maxScale, scale));
    }

    private void viewChanged() {
        fieldSampleCache.requestUpdate();
        datasetLodSwitch.update(view.getScale(), interacting);
        renderScheduler.scheduleRedraw();
    }
}
