package com.ammann.wearable.enumeration;

/**
 * Correlation regimes computed for every metric pair.
 */
public enum CorrelationKind
{
    /** Same calendar day. */
    DAILY,
    /** First metric on day d against second metric on day d+1. */
    LAG1,
    /** Same-day correlation over a sliding window advanced one day at a time. */
    ROLLING
}
