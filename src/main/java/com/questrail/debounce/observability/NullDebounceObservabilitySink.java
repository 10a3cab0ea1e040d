package com.questrail.debounce.observability;

/**
 * No-op implementation of DebounceObservabilitySink.
 */
public final class NullDebounceObservabilitySink implements DebounceObservabilitySink {
    public static final NullDebounceObservabilitySink INSTANCE = new NullDebounceObservabilitySink();

    private NullDebounceObservabilitySink() {}

    @Override
    public void onBurstStarted(String name) {}

    @Override
    public void onSuperseded(String name) {}

    @Override
    public void onExecuted(String name, DebounceEdge edge) {}

    @Override
    public void onCancelled(String name) {}
}
