package com.questrail.debounce.time;

import com.questrail.debounce.internal.time.Cancellable;
import com.questrail.debounce.internal.time.MonotonicScheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler whose cancellation never takes effect.
 *
 * Models a timer callback that was already dequeued on another thread when
 * {@code cancel()} arrived. Tests fire the captured tasks by hand.
 */
public final class LeakyScheduler implements MonotonicScheduler {

    private final List<Runnable> tasks = new ArrayList<>();

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        tasks.add(task);
        return () -> false;
    }

    /**
     * Runs every task ever scheduled, oldest first.
     */
    public void fireAll() {
        for (Runnable task : new ArrayList<>(tasks)) {
            task.run();
        }
    }
}
