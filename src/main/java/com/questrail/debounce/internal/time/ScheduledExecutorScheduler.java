package com.questrail.debounce.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} implementation backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the provided {@link MonotonicClock}. Callers must compute deadlines with
 * the same clock instance, typically {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Callers are
 * responsible for shutdown.</p>
 *
 * <h2>Event loop</h2>
 * <p>A single-thread executor gives the debouncers the single logical thread of
 * control they are written for: every delay and deadline callback then runs on
 * that one thread, in deadline order.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines already in the past run with zero delay.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // mayInterruptIfRunning=false: a debounced action that already started runs to completion
            return future.cancel(false);
        }
    }
}
