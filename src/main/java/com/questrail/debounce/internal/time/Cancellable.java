package com.questrail.debounce.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a single scheduled wake-up.
 *
 * <p>
 * Debouncers hold at most one of these per timer slot. Implemented by the
 * {@code ScheduledExecutorService}-backed scheduler and by the deterministic
 * scheduler used in tests.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
