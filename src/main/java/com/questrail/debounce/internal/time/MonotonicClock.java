package com.questrail.debounce.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for all debounce timing.
 *
 * <h2>Binding invariant</h2>
 * Delay and deadline arithmetic MUST use a monotonic time source. Wall-clock
 * time (e.g. {@code Instant.now()}) can jump and would stretch or shrink a
 * debounce window.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations and may wrap;
     * compare two ticks by the sign of their difference, as with
     * {@link System#nanoTime()}.
     */
    long nowNanos();
}
