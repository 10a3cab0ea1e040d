package com.questrail.debounce.observability;

/**
 * Receives debounce lifecycle notifications.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on whichever thread drove the transition and must not call
 * back into the debouncer that reported it.</p>
 */
public interface DebounceObservabilitySink {
    /**
     * Called when a request arrives while the debouncer is idle.
     * @param name the debouncer's name
     */
    void onBurstStarted(String name);

    /**
     * Called when a request replaces the pending action of an armed burst.
     * @param name the debouncer's name
     */
    void onSuperseded(String name);

    /**
     * Called just before a pending action executes.
     * @param name the debouncer's name
     * @param edge the rule that triggered execution
     */
    void onExecuted(String name, DebounceEdge edge);

    /**
     * Called when {@code cancel} or {@code dispose} discards an armed burst.
     * Not called for cancellation of an idle debouncer.
     * @param name the debouncer's name
     */
    void onCancelled(String name);
}
