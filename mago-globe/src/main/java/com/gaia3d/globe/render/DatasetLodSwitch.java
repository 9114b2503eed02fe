package com.gaia3d.globe.render;

import com.gaia3d.globe.scheduler.Cancellable;
import com.gaia3d.globe.scheduler.EventLoop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses between the low and high resolution whole-surface datasets.
 * Upgrades only after the condition has held for the delay, downgrades at once,
 * and stays low while the user is interacting.
 */
@Slf4j
public class DatasetLodSwitch {
    public static final double DEFAULT_THRESHOLD_SCALE = 600.0;
    public static final long DEFAULT_UPGRADE_DELAY_MS = 300;

    private final EventLoop eventLoop;
    @Getter
    private final double thresholdScale;
    @Getter
    private final long upgradeDelayMillis;
    private final Runnable redrawRequest;

    @Getter
    private DatasetResolution state = DatasetResolution.LOW;
    private double scale;
    private boolean interacting;
    @Getter
    private boolean highResAvailable;
    private Cancellable pendingUpgrade = Cancellable.NONE;
    @Getter
    private boolean upgradePending;

    public DatasetLodSwitch(EventLoop eventLoop, double thresholdScale, long upgradeDelayMillis, Runnable redrawRequest) {
        if (upgradeDelayMillis < 0) {
            throw new IllegalArgumentException("Upgrade delay cannot be negative: " + upgradeDelayMillis);
        }
        this.eventLoop = eventLoop;
        this.thresholdScale = thresholdScale;
        this.upgradeDelayMillis = upgradeDelayMillis;
        this.redrawRequest = redrawRequest;
    }

    public void update(double scale, boolean interacting) {
        this.scale = scale;
        this.interacting = interacting;
        evaluate();
    }

    public void setHighResAvailable(boolean highResAvailable) {
        this.highResAvailable = highResAvailable;
        evaluate();
    }

    private boolean conditionHolds() {
        return scale > thresholdScale && highResAvailable && !interacting;
    }

    private void evaluate() {
        if (!conditionHolds()) {
            cancelUpgrade();
            if (state == DatasetResolution.HIGH) {
                changeState(DatasetResolution.LOW);
            }
            return;
        }
        if (state == DatasetResolution.HIGH || upgradePending) {
            return;
        }
        upgradePending = true;
        pendingUpgrade = eventLoop.schedule(this::upgrade, upgradeDelayMillis);
    }

    private void upgrade() {
        upgradePending = false;
        pendingUpgrade = Cancellable.NONE;
        if (conditionHolds() && state == DatasetResolution.LOW) {
            changeState(DatasetResolution.HIGH);
        }
    }

    private void cancelUpgrade() {
        if (upgradePending) {
            pendingUpgrade.cancel();
            pendingUpgrade = Cancellable.NONE;
            upgradePending = false;
        }
    }

    private void changeState(DatasetResolution next) {
        log.debug("[Render][LOD] dataset {} -> {} (scale {})", state, next, scale);
        state = next;
        redrawRequest.run();
    }
}
