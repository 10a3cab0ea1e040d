package com.questrail.debounce.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler implementation.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskRunsOnceDeadlineElapses() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();

        scheduler.scheduleAtNanos(start + TimeUnit.MILLISECONDS.toNanos(50), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50), "Task must not run early");
    }

    @Test
    void pastDeadlineRunsWithoutDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(100, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);
        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        assertFalse(handle.cancel(), "Second cancel reports nothing left to cancel");

        Thread.sleep(120);
        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void tasksRunInDeadlineOrderOnExecutorThread() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicReference<Thread> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(2);

        long now = SystemMonotonicClock.INSTANCE.nowNanos();
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> {
            order.add(2);
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(10), () -> {
            order.add(1);
            thread.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertEquals(List.of(1, 2), order);
        assertNotSame(Thread.currentThread(), thread.get());
    }

    @Test
    void wrappedFarDeadlineIsNotTreatedAsPast() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        // now + Long.MAX_VALUE may wrap negative; the difference still says "far future".
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + Long.MAX_VALUE;
        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));

        Thread.sleep(50);
        assertFalse(executed.get());
        assertTrue(handle.cancel());
    }
}
