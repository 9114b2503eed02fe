package com.gaia3d.globe.render;

import com.gaia3d.globe.support.ManualEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class RenderSchedulerTest {

    @Test
    void testRedrawsAreCoalescedIntoOneFrame() {
        ManualEventLoop loop = new ManualEventLoop();
        RenderScheduler scheduler = new RenderScheduler(loop);
        AtomicInteger draws = new AtomicInteger();
        scheduler.setDrawPass(draws::incrementAndGet);

        for (int i = 0; i < 5; i++) {
            scheduler.scheduleRedraw();
        }
        assertEquals(1, loop.getPendingFrameCallbacks());
        assertTrue(scheduler.isFramePending());

        assertEquals(1, loop.runFrame());
        assertEquals(1, draws.get());
        assertEquals(1, scheduler.getFrameCount());
        assertFalse(scheduler.isFramePending());

        assertEquals(0, loop.runFrame());
        assertEquals(1, draws.get());
    }

    @Test
    void testRedrawRequestedWhileDrawingGetsNextFrame() {
        ManualEventLoop loop = new ManualEventLoop();
        RenderScheduler scheduler = new RenderScheduler(loop);
        AtomicInteger draws = new AtomicInteger();
        scheduler.setDrawPass(() -> {
            if (draws.incrementAndGet() == 1) {
                scheduler.scheduleRedraw();
            }
        });

        scheduler.scheduleRedraw();
        loop.runFrame();
        assertEquals(1, draws.get());
        assertEquals(1, loop.getPendingFrameCallbacks());

        loop.runFrame();
        assertEquals(2, draws.get());
        assertFalse(scheduler.isFramePending());
    }

    @Test
    void testFailingDrawDoesNotBlockLaterFrames() {
        ManualEventLoop loop = new ManualEventLoop();
        RenderScheduler scheduler = new RenderScheduler(loop);
        scheduler.setDrawPass(() -> {
            throw new IllegalStateException("draw failed");
        });

        scheduler.scheduleRedraw();
        assertDoesNotThrow(() -> loop.runFrame());
        assertFalse(scheduler.isFramePending());

        scheduler.scheduleRedraw();
        assertEquals(1, loop.getPendingFrameCallbacks());
    }
}
