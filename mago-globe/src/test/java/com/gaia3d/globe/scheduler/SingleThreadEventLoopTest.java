package com.gaia3d.globe.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@Tag("default")
public class SingleThreadEventLoopTest {

    @Test
    void testTasksRunInOrderOnTheLoopThread() throws InterruptedException {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop()) {
            List<Integer> order = new CopyOnWriteArrayList<>();
            AtomicBoolean onLoop = new AtomicBoolean(true);
            CountDownLatch done = new CountDownLatch(1);
            for (int i = 0; i < 10; i++) {
                int value = i;
                loop.execute(() -> {
                    order.add(value);
                    onLoop.compareAndSet(true, loop.isLoopThread());
                });
            }
            loop.execute(done::countDown);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), order);
            assertTrue(onLoop.get());
            assertFalse(loop.isLoopThread());
        }
    }

    @Test
    void testFailingTaskDoesNotStopTheLoop() throws InterruptedException {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop()) {
            CountDownLatch done = new CountDownLatch(1);
            loop.execute(() -> {
                throw new IllegalStateException("task failed");
            });
            loop.execute(done::countDown);
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void testFrameCallbacksRunOnTick() throws InterruptedException {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop(5)) {
            CountDownLatch frames = new CountDownLatch(2);
            loop.requestFrame(frames::countDown);
            loop.requestFrame(frames::countDown);
            assertTrue(frames.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void testCancelledTimerDoesNotRun() throws InterruptedException {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop()) {
            AtomicBoolean fired = new AtomicBoolean(false);
            Cancellable timer = loop.schedule(() -> fired.set(true), 200);
            assertTrue(timer.cancel());

            CountDownLatch later = new CountDownLatch(1);
            loop.schedule(later::countDown, 300);
            assertTrue(later.await(5, TimeUnit.SECONDS));
            assertFalse(fired.get());
        }
    }

    @Test
    void testInvalidFrameInterval() {
        assertThrows(IllegalArgumentException.class, () -> new SingleThreadEventLoop(0));
    }
}
