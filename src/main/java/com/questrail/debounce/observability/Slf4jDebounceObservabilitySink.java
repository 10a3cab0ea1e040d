package com.questrail.debounce.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of DebounceObservabilitySink that emits logs via SLF4J.
 *
 * <p>Supersession is by far the most frequent event, so it goes to TRACE.</p>
 */
public final class Slf4jDebounceObservabilitySink implements DebounceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDebounceObservabilitySink.class);

    @Override
    public void onBurstStarted(String name) {
        log.debug("Debouncer {}: burst started", name);
    }

    @Override
    public void onSuperseded(String name) {
        log.trace("Debouncer {}: pending action superseded", name);
    }

    @Override
    public void onExecuted(String name, DebounceEdge edge) {
        log.debug("Debouncer {}: executing on {} edge", name, edge);
    }

    @Override
    public void onCancelled(String name) {
        log.debug("Debouncer {}: burst cancelled", name);
    }
}
