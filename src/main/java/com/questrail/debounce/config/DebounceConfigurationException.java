package com.questrail.debounce.config;

/**
 * Indicates that a debouncer was configured with options that cannot produce
 * any execution schedule.
 *
 * This typically reflects:
 * <ul>
 *   <li>both the leading and the trailing edge disabled</li>
 *   <li>a negative delay or max-wait window</li>
 * </ul>
 *
 * Thrown synchronously while the options are built; no debouncer instance is
 * ever created from invalid options.
 */
public final class DebounceConfigurationException extends IllegalArgumentException
{
    public DebounceConfigurationException(String message) {
        super(message);
    }
}
