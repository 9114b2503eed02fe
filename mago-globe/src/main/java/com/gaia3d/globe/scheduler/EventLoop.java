package com.gaia3d.globe.scheduler;

/**
 * Single-threaded cooperative loop that owns every cache and scheduling decision.
 * Asynchronous results (tile fetches, timers) re-enter the core only through this loop,
 * so the caches never need locking.
 */
public interface EventLoop {

    /**
     * Runs the task on the loop thread, after the currently running task.
     */
    void execute(Runnable task);

    /**
     * Runs the task on the loop thread once the delay has elapsed.
     */
    Cancellable schedule(Runnable task, long delayMillis);

    /**
     * Registers a callback for the next display refresh tick.
     */
    void requestFrame(Runnable frameCallback);

    long currentTimeMillis();
}
