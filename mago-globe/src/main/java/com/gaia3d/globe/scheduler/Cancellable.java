package com.gaia3d.globe.scheduler;

/**
 * Handle of a delayed task that can still be withdrawn.
 */
@FunctionalInterface
public interface Cancellable {
    Cancellable NONE = () -> false;

    /**
     * @return true if the task was still waiting and will not run
     */
    boolean cancel();
}
