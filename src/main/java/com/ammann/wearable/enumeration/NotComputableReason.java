package com.ammann.wearable.enumeration;

/**
 * Why a statistic carries the NOT_COMPUTABLE sentinel instead of a value.
 */
public enum NotComputableReason
{
    /** Fewer observations than the configured minimum. */
    INSUFFICIENT_DATA,
    /** At least one input has zero variance. */
    DEGENERATE_SERIES
}
