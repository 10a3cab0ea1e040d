package com.questrail.debounce.observability;

/**
 * Which timing rule caused a debounced action to execute.
 */
public enum DebounceEdge {
    /** First request of a burst, executed synchronously inside {@code run}. */
    LEADING,
    /** Delay timer elapsed without a newer request. */
    TRAILING,
    /** Max-wait deadline reached while requests kept arriving. */
    MAX_WAIT
}
