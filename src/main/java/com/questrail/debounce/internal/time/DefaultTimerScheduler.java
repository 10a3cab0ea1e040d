package com.questrail.debounce.internal.time;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DefaultTimerScheduler
 * =============================================================================
 * Lazily created, process-wide timer thread used by the convenience
 * constructors ({@code new Debouncer(300)}).
 *
 * <p>The thread is a daemon so an application never has to shut it down.
 * Cancelled wake-ups are removed from the queue immediately, since debouncers
 * cancel far more timers than they let fire.</p>
 *
 * <h2>Action failures</h2>
 * <p>A scheduled executor captures a task's exception in its future, and
 * nobody reads the futures of debounce timers. This executor unwraps the
 * failure after each task and hands it to the timer thread's
 * {@link Thread.UncaughtExceptionHandler}, as a plain thread would.</p>
 *
 * <p>Callers that need a different threading model should construct the
 * debouncers with their own {@link MonotonicScheduler}.</p>
 */
public final class DefaultTimerScheduler {

    private DefaultTimerScheduler() {}

    /**
     * Returns the shared scheduler, creating its thread on first use.
     */
    public static MonotonicScheduler scheduler() {
        return Holder.SCHEDULER;
    }

    private static final class Holder {
        private static final MonotonicScheduler SCHEDULER = create();

        private static MonotonicScheduler create() {
            ScheduledThreadPoolExecutor executor = new FailureReportingExecutor(new DaemonThreadFactory());
            executor.setRemoveOnCancelPolicy(true);
            return new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
        }
    }

    static final class FailureReportingExecutor extends ScheduledThreadPoolExecutor {

        FailureReportingExecutor(ThreadFactory threadFactory) {
            super(1, threadFactory);
        }

        @Override
        protected void afterExecute(Runnable r, Throwable t) {
            super.afterExecute(r, t);

            Throwable failure = t;
            if (failure == null && r instanceof Future<?>) {
                Future<?> future = (Future<?>) r;
                // Cancelled timers are routine and carry no failure.
                if (future.isDone() && !future.isCancelled()) {
                    try {
                        future.get();
                    } catch (ExecutionException e) {
                        failure = e.getCause();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }

            if (failure != null) {
                Thread current = Thread.currentThread();
                current.getUncaughtExceptionHandler().uncaughtException(current, failure);
            }
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "debounce-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
