package com.ammann.wearable.enumeration;

/**
 * Outcome of a baseline computation for one participant and metric.
 */
public enum BaselineStatus
{
    /** Center and spread are usable. */
    VALID,
    /** Fewer samples than the configured minimum. */
    INSUFFICIENT_DATA,
    /** Interquartile range and median absolute deviation are both zero. */
    DEGENERATE_SERIES;

    public boolean isValid() {
        return this == VALID;
    }
}
