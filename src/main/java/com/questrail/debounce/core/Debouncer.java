package com.questrail.debounce.core;

import com.questrail.debounce.api.CoalescingScheduler;
import com.questrail.debounce.config.DebounceConfigurationException;
import com.questrail.debounce.config.DebounceOptions;
import com.questrail.debounce.internal.time.Cancellable;
import com.questrail.debounce.internal.time.DefaultTimerScheduler;
import com.questrail.debounce.internal.time.MonotonicClock;
import com.questrail.debounce.internal.time.MonotonicScheduler;
import com.questrail.debounce.internal.time.SystemMonotonicClock;
import com.questrail.debounce.observability.DebounceEdge;
import com.questrail.debounce.observability.DebounceObservabilitySink;
import com.questrail.debounce.observability.NullDebounceObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debouncer
 * =============================================================================
 * Trailing-edge coalescing timer: delays an action and restarts the delay on
 * every new request, so only the most recent request executes.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #run(Runnable)} overwrites the pending action and re-arms the
 *       delay timer. Earlier actions are dropped without notice.</li>
 *   <li>When the delay elapses with no newer request, state is cleared and the
 *       pending action runs exactly once.</li>
 *   <li>{@link #cancel()} and {@link #dispose()} drop the pending action.</li>
 * </ul>
 *
 * <pre>{@code
 * Debouncer debouncer = new Debouncer(300);
 * searchField.onChange(text -> debouncer.run(() -> search(text)));
 * }</pre>
 *
 * <h2>Threading</h2>
 * <p>Written for a single logical thread of control. Instance state is
 * nevertheless guarded so timer callbacks from an executor thread cannot
 * corrupt it, and actions always run outside that guard so they may call
 * {@link #run(Runnable)} on the same instance.</p>
 */
public final class Debouncer implements CoalescingScheduler {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final String name;
    private final Duration delay;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final DebounceObservabilitySink sink;

    private final Object mutex = new Object();

    private long timerSequence = 0;
    // Sequence of the currently armed timer; 0 when idle. Fired callbacks
    // carrying any other value are stale and do nothing.
    private long armedSequence = 0;
    private Cancellable timer;
    private long deadlineNanos;
    private Runnable pendingAction;

    /**
     * Creates a debouncer driven by the shared daemon timer thread.
     *
     * @param delayMillis delay in milliseconds, must be non-negative
     */
    public Debouncer(long delayMillis) {
        this(checkedDelay(delayMillis), DefaultTimerScheduler.scheduler(), SystemMonotonicClock.INSTANCE);
    }

    public Debouncer(Duration delay, MonotonicScheduler scheduler, MonotonicClock clock) {
        this("debouncer-" + NEXT_ID.incrementAndGet(), delay, scheduler, clock, NullDebounceObservabilitySink.INSTANCE);
    }

    public Debouncer(String name,
                     Duration delay,
                     MonotonicScheduler scheduler,
                     MonotonicClock clock,
                     DebounceObservabilitySink sink)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (delay.isNegative()) {
            throw new DebounceConfigurationException("delay must be non-negative");
        }
        if (delay.compareTo(DebounceOptions.MAX_WINDOW) > 0) {
            throw new DebounceConfigurationException("delay must not exceed " + DebounceOptions.MAX_WINDOW);
        }
    }

    private static Duration checkedDelay(long delayMillis) {
        if (delayMillis < 0) {
            throw new DebounceConfigurationException("delay must be non-negative");
        }
        return Duration.ofMillis(delayMillis);
    }

    public String name() {
        return name;
    }

    public Duration delay() {
        return delay;
    }

    @Override
    public void run(Runnable action) {
        Objects.requireNonNull(action, "action");

        boolean superseded;
        synchronized (mutex) {
            long seq = ++timerSequence;
            long deadline = clock.nowNanos() + delay.toNanos();
            // Arm before touching state: a rejected schedule leaves the prior burst intact.
            Cancellable armed = scheduler.scheduleAtNanos(deadline, () -> onDelayElapsed(seq));

            superseded = pendingAction != null;
            cancelTimerLocked();

            pendingAction = action;
            armedSequence = seq;
            deadlineNanos = deadline;
            timer = armed;
        }

        if (superseded) {
            sink.onSuperseded(name);
        } else {
            sink.onBurstStarted(name);
        }
    }

    private void onDelayElapsed(long seq) {
        Runnable action;
        synchronized (mutex) {
            if (seq != armedSequence) {
                return;
            }
            action = pendingAction;
            timer = null;
            armedSequence = 0;
            pendingAction = null;
        }

        // State is already clear: a throwing action leaves the instance idle,
        // and a nested run() from inside the action starts a fresh burst.
        if (action != null) {
            sink.onExecuted(name, DebounceEdge.TRAILING);
            action.run();
        }
    }

    @Override
    public void cancel() {
        boolean wasActive;
        synchronized (mutex) {
            wasActive = timer != null;
            cancelTimerLocked();
            pendingAction = null;
        }
        if (wasActive) {
            sink.onCancelled(name);
        }
    }

    @Override
    public void dispose() {
        cancel();
    }

    @Override
    public boolean isActive() {
        synchronized (mutex) {
            return timer != null;
        }
    }

    @Override
    public Duration remainingTime() {
        synchronized (mutex) {
            if (timer == null) {
                return Duration.ZERO;
            }
            return Duration.ofNanos(Math.max(0, deadlineNanos - clock.nowNanos()));
        }
    }

    private void cancelTimerLocked() {
        Cancellable prior = timer;
        if (prior != null) {
            prior.cancel();
            timer = null;
        }
        armedSequence = 0;
    }

    @Override
    public String toString() {
        return "Debouncer[" + name + ", delay=" + delay + "]";
    }
}
