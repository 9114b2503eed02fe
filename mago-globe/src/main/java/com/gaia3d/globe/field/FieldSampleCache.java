package com.gaia3d.globe.field;

import com.gaia3d.globe.scheduler.Cancellable;
import com.gaia3d.globe.scheduler.EventLoop;
import com.gaia3d.globe.view.ViewState;
import com.gaia3d.util.GlobeUtils;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Holds the one current {@link FieldGrid} and regenerates it when the view moves materially.
 * While the view is moving a coarse grid is produced at most once per frame; once the view has
 * been still for the settle delay a fine grid replaces it.
 * Everything except {@link #getCurrent()} must be called on the event loop thread.
 */
@Slf4j
public class FieldSampleCache {
    public static final double ROTATION_THRESHOLD_DEG = 0.5;
    public static final double SCALE_THRESHOLD_RATIO = 0.05;
    public static final long THROTTLE_MS = 16;
    public static final long SETTLE_DELAY_MS = 200;
    public static final int MIN_HIGH_DETAIL = 15;
    public static final int MAX_LOW_DETAIL = 5;
    public static final int DEFAULT_RESOLUTION = 8;

    private final EventLoop eventLoop;
    private final Supplier<ViewState> liveView;

    private FieldModel model;
    @Getter
    private FieldModelParameters modelParameters;
    @Getter
    private int resolution;

    private volatile FieldGrid current;
    private volatile long regenerationCount = 0;

    private long lastThrottledUpdate = Long.MIN_VALUE;
    private Cancellable settleTimer = Cancellable.NONE;

    /**
     * Called on the loop thread after a grid replaced the current one outside of {@link #ensureCurrent}.
     */
    @Setter
    private Runnable onGridUpdated = () -> { };

    public FieldSampleCache(EventLoop eventLoop, Supplier<ViewState> liveView, FieldModel model,
                            FieldModelParameters modelParameters, int resolution) {
        this.eventLoop = eventLoop;
        this.liveView = liveView;
        this.model = model;
        this.modelParameters = modelParameters;
        this.resolution = validateResolution(resolution);
    }

    public FieldGrid getCurrent() {
        return current;
    }

    public long getRegenerationCount() {
        return regenerationCount;
    }

    public int getHighDetailLevel() {
        return Math.max(MIN_HIGH_DETAIL, resolution);
    }

    public int getLowDetailLevel() {
        return Math.min(MAX_LOW_DETAIL, resolution);
    }

    /**
     * Returns a grid valid for the view, regenerating when there is none, when the model
     * parameters changed (high detail) or when the view moved materially (low detail).
     */
    public FieldGrid ensureCurrent(ViewState view) {
        FieldGrid grid = current;
        if (grid == null || !grid.getModelParameters().equals(modelParameters)) {
            return regenerate(true, view);
        }
        if (hasViewChanged(grid.getGeneratedAgainstView(), view)) {
            return regenerate(false, view);
        }
        return grid;
    }

    /**
     * Regenerates against the live view.
     */
    public FieldGrid regenerate(boolean highDetail) {
        return regenerate(highDetail, liveView.get());
    }

    public FieldGrid regenerate(boolean highDetail, ViewState view) {
        long start = System.nanoTime();
        int detail = highDetail ? getHighDetailLevel() : getLowDetailLevel();
        double step = 180.0 / detail;
        FieldModelParameters parameters = modelParameters;

        List<FieldSample> samples = new ArrayList<>((2 * detail + 1) * (detail + 1));
        int skipped = 0;
        for (int column = 0; column <= 2 * detail; column++) {
            double lon = -180.0 + column * step;
            for (int row = 0; row <= detail; row++) {
                double lat = -90.0 + row * step;
                try {
                    double value = model.evaluate(lat, lon);
                    if (Double.isFinite(value)) {
                        samples.add(new FieldSample(lat, lon, value));
                    } else {
                        skipped++;
                    }
                } catch (FieldEvaluationException e) {
                    skipped++;
                } catch (RuntimeException e) {
                    log.debug("[Field] model failed at ({}, {}): {}", lat, lon, e.toString());
                    skipped++;
                }
            }
        }

        FieldGrid grid = new FieldGrid(samples, detail, highDetail, view, parameters, skipped);
        current = grid;
        regenerationCount++;
        log.debug("[Field] regenerated {} in {} ms", grid, (System.nanoTime() - start) / 1_000_000);
        return grid;
    }

    /**
     * Reacts to a view mutation: refreshes the grid at most once per frame and restarts the settle
     * timer that produces the fine grid.
     */
    public void requestUpdate() {
        long now = eventLoop.currentTimeMillis();
        if (lastThrottledUpdate == Long.MIN_VALUE || now - lastThrottledUpdate >= THROTTLE_MS) {
            lastThrottledUpdate = now;
            FieldGrid before = current;
            if (ensureCurrent(liveView.get()) != before) {
                onGridUpdated.run();
            }
        }

        settleTimer.cancel();
        settleTimer = eventLoop.schedule(this::settle, SETTLE_DELAY_MS);
    }

    private void settle() {
        settleTimer = Cancellable.NONE;
        regenerate(true);
        onGridUpdated.run();
    }

    public void setModel(FieldModel model) {
        this.model = model;
        invalidate();
    }

    /**
     * Changing the year or altitude makes the current grid stale; it is rebuilt at high detail
     * on the next {@link #ensureCurrent}.
     */
    public void setModelParameters(FieldModelParameters modelParameters) {
        if (this.modelParameters.equals(modelParameters)) {
            return;
        }
        log.info("[Field] model parameters changed: {} -> {}", this.modelParameters, modelParameters);
        this.modelParameters = modelParameters;
        onGridUpdated.run();
    }

    public void setResolution(int resolution) {
        int validated = validateResolution(resolution);
        if (validated != this.resolution) {
            this.resolution = validated;
            invalidate();
        }
    }

    private void invalidate() {
        current = null;
        onGridUpdated.run();
    }

    static boolean hasViewChanged(ViewState previous, ViewState next) {
        if (angleDelta(previous.getYaw(), next.getYaw()) > ROTATION_THRESHOLD_DEG
                || angleDelta(previous.getPitch(), next.getPitch()) > ROTATION_THRESHOLD_DEG
                || angleDelta(previous.getRoll(), next.getRoll()) > ROTATION_THRESHOLD_DEG) {
            return true;
        }
        return Math.abs(next.getScale() - previous.getScale()) / previous.getScale() > SCALE_THRESHOLD_RATIO;
    }

    private static double angleDelta(double a, double b) {
        return Math.abs(GlobeUtils.normalizeLongitude(a - b));
    }

    private static int validateResolution(int resolution) {
        if (resolution <= 0) {
            throw new IllegalArgumentException("Field resolution must be positive: " + resolution);
        }
        return resolution;
    }
}
