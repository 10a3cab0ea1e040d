package com.questrail.debounce.core;

import com.questrail.debounce.api.CoalescingScheduler;
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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AdvancedDebouncer
 * =============================================================================
 * Coalescing scheduler with optional leading-edge execution and a hard
 * max-wait deadline.
 *
 * <h2>Timers</h2>
 * <ul>
 *   <li><b>Delay timer</b> — restarted by every {@link #run(Runnable)}. When it
 *       elapses, the pending action runs if {@code trailing} is enabled.</li>
 *   <li><b>Max-wait timer</b> — armed by the first request of a burst when
 *       {@code maxWait} is configured and never restarted within the burst.
 *       When it elapses, the pending action runs regardless of
 *       {@code leading}/{@code trailing}. This keeps a continuous request
 *       stream from postponing execution forever.</li>
 * </ul>
 *
 * <h2>Burst resolution</h2>
 * Either timer firing, or {@link #cancel()}, resolves the burst: both timers
 * are disarmed, the pending action is cleared and the leading edge is re-enabled.
 * A burst resolves at most once; callbacks from timers of a resolved burst are
 * ignored.
 *
 * <h2>Both edges</h2>
 * With {@code leading} and {@code trailing} both enabled, a single request runs
 * twice: once immediately and once when the delay elapses. The trailing edge
 * does not check whether the leading edge already served the burst.
 *
 * <h2>Threading</h2>
 * <p>Same model as {@link Debouncer}: state guarded, actions run outside the
 * guard. The leading edge runs on the caller's thread inside {@code run}.</p>
 */
public final class AdvancedDebouncer implements CoalescingScheduler {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final String name;
    private final DebounceOptions options;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final DebounceObservabilitySink sink;

    private final Object mutex = new Object();

    private long timerSequence = 0;

    private Cancellable delayTimer;
    private long delaySequence = 0;
    private long delayDeadlineNanos;

    private Cancellable maxWaitTimer;
    private long maxWaitSequence = 0;
    private long maxWaitDeadlineNanos;

    private boolean hasInvoked = false;
    private Runnable pendingAction;

    /**
     * Trailing-only debouncer on the shared daemon timer thread.
     */
    public AdvancedDebouncer(long delayMillis) {
        this(DebounceOptions.trailing(Duration.ofMillis(delayMillis)));
    }

    /**
     * Debouncer on the shared daemon timer thread.
     */
    public AdvancedDebouncer(DebounceOptions options) {
        this(options, DefaultTimerScheduler.scheduler(), SystemMonotonicClock.INSTANCE);
    }

    public AdvancedDebouncer(DebounceOptions options, MonotonicScheduler scheduler, MonotonicClock clock) {
        this("advanced-debouncer-" + NEXT_ID.incrementAndGet(), options, scheduler, clock,
                NullDebounceObservabilitySink.INSTANCE);
    }

    public AdvancedDebouncer(String name,
                             DebounceOptions options,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             DebounceObservabilitySink sink)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public String name() {
        return name;
    }

    public DebounceOptions options() {
        return options;
    }

    @Override
    public void run(Runnable action) {
        Objects.requireNonNull(action, "action");

        boolean started;
        boolean superseded;
        boolean fireLeading;
        synchronized (mutex) {
            long now = clock.nowNanos();

            // Arm both timers before touching state: a rejected schedule leaves
            // the current burst exactly as it was.
            long delaySeq = ++timerSequence;
            long delayDeadline = now + options.delay().toNanos();
            Cancellable newDelayTimer = scheduler.scheduleAtNanos(delayDeadline, () -> onDelayElapsed(delaySeq));

            Optional<Duration> maxWait = options.maxWaitWindow();
            Cancellable newMaxWaitTimer = null;
            long maxWaitSeq = 0;
            long maxWaitDeadline = 0;
            if (maxWait.isPresent() && maxWaitTimer == null) {
                maxWaitSeq = ++timerSequence;
                maxWaitDeadline = now + maxWait.get().toNanos();
                long seq = maxWaitSeq;
                try {
                    newMaxWaitTimer = scheduler.scheduleAtNanos(maxWaitDeadline, () -> onMaxWaitElapsed(seq));
                } catch (RuntimeException e) {
                    newDelayTimer.cancel();
                    throw e;
                }
            }

            started = !isActiveLocked();
            superseded = pendingAction != null;

            pendingAction = action;
            fireLeading = options.leading() && !hasInvoked;

            if (delayTimer != null) {
                delayTimer.cancel();
            }
            delayTimer = newDelayTimer;
            delaySequence = delaySeq;
            delayDeadlineNanos = delayDeadline;

            if (newMaxWaitTimer != null) {
                maxWaitTimer = newMaxWaitTimer;
                maxWaitSequence = maxWaitSeq;
                maxWaitDeadlineNanos = maxWaitDeadline;
            }

            // Marked before the action runs so a nested run() from the leading
            // action cannot fire the leading edge a second time.
            if (fireLeading) {
                hasInvoked = true;
            }
        }

        if (started) {
            sink.onBurstStarted(name);
        } else if (superseded) {
            sink.onSuperseded(name);
        }

        if (fireLeading) {
            sink.onExecuted(name, DebounceEdge.LEADING);
            action.run();
        }
    }

    private void onDelayElapsed(long seq) {
        Runnable action;
        synchronized (mutex) {
            if (seq != delaySequence) {
                return;
            }
            action = options.trailing() ? pendingAction : null;
            resetLocked();
        }

        if (action != null) {
            sink.onExecuted(name, DebounceEdge.TRAILING);
            action.run();
        }
    }

    private void onMaxWaitElapsed(long seq) {
        Runnable action;
        synchronized (mutex) {
            if (seq != maxWaitSequence) {
                return;
            }
            action = pendingAction;
            resetLocked();
        }

        if (action != null) {
            sink.onExecuted(name, DebounceEdge.MAX_WAIT);
            action.run();
        }
    }

    @Override
    public void cancel() {
        boolean wasActive;
        synchronized (mutex) {
            wasActive = isActiveLocked();
            resetLocked();
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
            return isActiveLocked();
        }
    }

    @Override
    public Duration remainingTime() {
        synchronized (mutex) {
            if (!isActiveLocked()) {
                return Duration.ZERO;
            }
            long next;
            if (delayTimer == null) {
                next = maxWaitDeadlineNanos;
            } else if (maxWaitTimer != null && maxWaitDeadlineNanos - delayDeadlineNanos < 0) {
                next = maxWaitDeadlineNanos;
            } else {
                next = delayDeadlineNanos;
            }
            return Duration.ofNanos(Math.max(0, next - clock.nowNanos()));
        }
    }

    private boolean isActiveLocked() {
        return delayTimer != null || maxWaitTimer != null;
    }

    private void resetLocked() {
        if (delayTimer != null) {
            delayTimer.cancel();
            delayTimer = null;
        }
        if (maxWaitTimer != null) {
            maxWaitTimer.cancel();
            maxWaitTimer = null;
        }
        delaySequence = 0;
        maxWaitSequence = 0;
        hasInvoked = false;
        pendingAction = null;
    }

    @Override
    public String toString() {
        return "AdvancedDebouncer[" + name + ", " + options + "]";
    }
}
