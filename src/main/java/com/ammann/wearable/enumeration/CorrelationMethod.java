package com.ammann.wearable.enumeration;

/**
 * Correlation coefficient estimators. Both are always reported.
 */
public enum CorrelationMethod
{
    /** Linear (product-moment) correlation. */
    PEARSON,
    /** Rank correlation, sensitive to monotonic relationships. */
    SPEARMAN
}
