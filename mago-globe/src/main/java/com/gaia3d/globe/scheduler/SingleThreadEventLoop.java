package com.gaia3d.globe.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by one scheduler thread. Frame callbacks are collected and drained
 * together on a fixed-rate tick, which plays the role of the display refresh.
 */
@Slf4j
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {
    public static final long DEFAULT_FRAME_INTERVAL_MS = 16;

    private final ScheduledExecutorService executor;
    private final List<Runnable> frameCallbacks = new ArrayList<>();
    private final ScheduledFuture<?> frameTicker;
    private volatile Thread loopThread;

    public SingleThreadEventLoop() {
        this(DEFAULT_FRAME_INTERVAL_MS);
    }

    public SingleThreadEventLoop(long frameIntervalMillis) {
        if (frameIntervalMillis <= 0) {
            throw new IllegalArgumentException("Frame interval must be positive: " + frameIntervalMillis);
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "globe-loop");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.frameTicker = executor.scheduleAtFixedRate(this::tick, frameIntervalMillis, frameIntervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void requestFrame(Runnable frameCallback) {
        execute(() -> frameCallbacks.add(frameCallback));
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    private void tick() {
        if (frameCallbacks.isEmpty()) {
            return;
        }
        // callbacks registered while draining belong to the next tick
        List<Runnable> callbacks = new ArrayList<>(frameCallbacks);
        frameCallbacks.clear();
        for (Runnable callback : callbacks) {
            guarded(callback).run();
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[EventLoop] task failed", e);
            }
        };
    }

    @Override
    public void close() {
        frameTicker.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
