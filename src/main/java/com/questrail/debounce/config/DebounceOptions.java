package com.questrail.debounce.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * DebounceOptions
 * -----------------------------------------------------------------------------
 * Timing and edge configuration for an {@code AdvancedDebouncer}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>delay</b> — Quiet period that must elapse after the latest request
 *       before the trailing edge fires. Restarted by every request.</li>
 *   <li><b>maxWait</b> — Optional hard bound, measured from the first request of
 *       a burst, after which the latest action runs even if requests keep
 *       arriving. {@code null} means unbounded. Values below {@code delay} are
 *       accepted.</li>
 *   <li><b>leading</b> — Run the first request of a burst immediately.</li>
 *   <li><b>trailing</b> — Run the latest request once the delay elapses.</li>
 * </ul>
 *
 * <p>At least one of {@code leading} and {@code trailing} must be enabled.</p>
 */
public record DebounceOptions(
        Duration delay,
        Duration maxWait,
        boolean leading,
        boolean trailing
) {
    /**
     * Longest delay or max-wait window that fits in monotonic nanoseconds
     * (about 292 years).
     */
    public static final Duration MAX_WINDOW = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * Canonical constructor with validation.
     *
     * @throws DebounceConfigurationException if the combination can never execute an action
     */
    public DebounceOptions {
        Objects.requireNonNull(delay, "delay");

        if (delay.isNegative()) {
            throw new DebounceConfigurationException("delay must be non-negative");
        }
        if (delay.compareTo(MAX_WINDOW) > 0) {
            throw new DebounceConfigurationException("delay must not exceed " + MAX_WINDOW);
        }
        if (maxWait != null && maxWait.isNegative()) {
            throw new DebounceConfigurationException("maxWait must be non-negative");
        }
        if (maxWait != null && maxWait.compareTo(MAX_WINDOW) > 0) {
            throw new DebounceConfigurationException("maxWait must not exceed " + MAX_WINDOW);
        }
        if (!leading && !trailing) {
            throw new DebounceConfigurationException("At least one of leading or trailing must be true");
        }
    }

    /**
     * Returns the max-wait window if one is configured.
     */
    public Optional<Duration> maxWaitWindow() {
        return Optional.ofNullable(maxWait);
    }

    /**
     * Classic trailing-edge debounce without a max-wait bound.
     */
    public static DebounceOptions trailing(Duration delay) {
        return new DebounceOptions(delay, null, false, true);
    }

    /**
     * Leading-edge only: the first request of a burst runs immediately and the
     * rest of the burst is swallowed.
     */
    public static DebounceOptions leading(Duration delay) {
        return new DebounceOptions(delay, null, true, false);
    }

    /**
     * Trailing-edge debounce tuned for text input feeding a search query.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>delay: 300ms</li>
     *   <li>maxWait: none</li>
     *   <li>leading: false</li>
     *   <li>trailing: true</li>
     * </ul>
     */
    public static DebounceOptions defaults() {
        return trailing(Duration.ofMillis(300));
    }

    public static Builder builder(Duration delay) {
        return new Builder(delay);
    }

    public static final class Builder {
        private final Duration delay;
        private Duration maxWait;
        private boolean leading = false;
        private boolean trailing = true;

        private Builder(Duration delay) {
            this.delay = delay;
        }

        public Builder withMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder withLeading(boolean leading) {
            this.leading = leading;
            return this;
        }

        public Builder withTrailing(boolean trailing) {
            this.trailing = trailing;
            return this;
        }

        public DebounceOptions build() {
            return new DebounceOptions(delay, maxWait, leading, trailing);
        }
    }
}
