package com.questrail.debounce.internal.time;

import com.questrail.debounce.core.Debouncer;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DefaultTimerSchedulerTest {

    @Test
    void sharedSchedulerIsSingleton() {
        assertSame(DefaultTimerScheduler.scheduler(), DefaultTimerScheduler.scheduler());
    }

    @Test
    void tasksRunOnDaemonTimerThread() throws InterruptedException {
        AtomicReference<Thread> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        DefaultTimerScheduler.scheduler().scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> {
            thread.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertTrue(thread.get().isDaemon());
        assertTrue(thread.get().getName().startsWith("debounce-timer-"));
    }

    @Test
    void failingDebouncedActionReachesUncaughtExceptionHandler() throws InterruptedException {
        AtomicReference<Throwable> reported = new AtomicReference<>();
        AtomicReference<Thread> reportingThread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        Thread.UncaughtExceptionHandler previous = Thread.getDefaultUncaughtExceptionHandler();
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            reportingThread.set(thread);
            reported.set(error);
            latch.countDown();
        });
        try {
            new Debouncer(0).run(() -> { throw new IllegalStateException("boom"); });

            assertTrue(latch.await(1, TimeUnit.SECONDS), "Failure should reach the handler");
            IllegalStateException error = assertInstanceOf(IllegalStateException.class, reported.get());
            assertEquals("boom", error.getMessage());
            assertTrue(reportingThread.get().getName().startsWith("debounce-timer-"));
        } finally {
            Thread.setDefaultUncaughtExceptionHandler(previous);
        }
    }

    @Test
    void cancelledTimerIsNotReportedAsFailure() throws InterruptedException {
        AtomicReference<Throwable> reported = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        DefaultTimerScheduler.FailureReportingExecutor executor = new DefaultTimerScheduler.FailureReportingExecutor(r -> {
            Thread thread = new Thread(r);
            thread.setUncaughtExceptionHandler((t, e) -> reported.set(e));
            return thread;
        });
        try {
            ScheduledExecutorScheduler scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
            long now = SystemMonotonicClock.INSTANCE.nowNanos();

            Cancellable handle = scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20),
                    () -> { throw new IllegalStateException("never"); });
            assertTrue(handle.cancel());
            scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), done::countDown);

            assertTrue(done.await(1, TimeUnit.SECONDS));
            Thread.sleep(20);
            assertNull(reported.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
