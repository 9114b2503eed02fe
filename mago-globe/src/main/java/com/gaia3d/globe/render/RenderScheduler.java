package com.gaia3d.globe.render;

import com.gaia3d.globe.scheduler.EventLoop;
import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces redraw requests: however many arrive before the next frame, the draw pass runs once.
 */
@Slf4j
public class RenderScheduler {
    private final EventLoop eventLoop;
    private Runnable drawPass = () -> { };
    private volatile boolean framePending = false;
    private volatile long frameCount = 0;

    public RenderScheduler(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
    }

    public void setDrawPass(Runnable drawPass) {
        this.drawPass = drawPass;
    }

    public void scheduleRedraw() {
        if (framePending) {
            return;
        }
        framePending = true;
        eventLoop.requestFrame(this::runFrame);
    }

    private void runFrame() {
        // cleared first, so a redraw requested while drawing gets its own frame
        framePending = false;
        frameCount++;
        try {
            drawPass.run();
        } catch (RuntimeException e) {
            log.error("[Render] draw pass failed", e);
        }
    }

    public boolean isFramePending() {
        return framePending;
    }

    public long getFrameCount() {
        return frameCount;
    }
}
