package com.questrail.debounce.api;

import java.time.Duration;

/**
 * CoalescingScheduler
 * -----------------------------------------------------------------------------
 * {@code CoalescingScheduler} decides <em>when</em> a caller-supplied action
 * runs. Callers submit actions through {@link #run(Runnable)}; bursts of
 * submissions are coalesced so that only the most recent action executes.
 *
 * <h2>What it is not</h2>
 * <ul>
 *   <li>It is not a queue: a newer action silently replaces an unexecuted one.</li>
 *   <li>It never discovers work on its own and never touches application state.</li>
 *   <li>It does not catch, log or retry failures thrown by an action.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * An instance exclusively owns its timers. {@link #cancel()} and
 * {@link #dispose()} are synchronous and idempotent and always leave the
 * instance with nothing pending. An action that has already started cannot be
 * cancelled.
 */
public interface CoalescingScheduler extends AutoCloseable
{
    /**
     * Submits an action, replacing any pending one and (re)arming timers.
     *
     * @param action the action to run once the timing rules allow it
     */
    void run(Runnable action);

    /**
     * Discards the pending action and disarms all timers without executing.
     */
    void cancel();

    /**
     * Releases the instance. Same effect as {@link #cancel()}; a later
     * {@link #run(Runnable)} is not rejected.
     */
    void dispose();

    /**
     * Whether any timer is currently armed.
     */
    boolean isActive();

    /**
     * Time left until the next armed timer fires, or {@link Duration#ZERO}
     * when nothing is armed.
     */
    Duration remainingTime();

    /**
     * Equivalent to {@link #dispose()}, for try-with-resources.
     */
    @Override
    default void close() {
        dispose();
    }
}
