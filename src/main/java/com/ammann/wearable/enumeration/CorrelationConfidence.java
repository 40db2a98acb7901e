package com.ammann.wearable.enumeration;

/**
 * Qualitative confidence in a correlation based on sample size and effect size.
 */
public enum CorrelationConfidence
{
    /** At least 30 observations and |r| of 0.5 or more. */
    STRONG,
    /** At least 14 observations and |r| of 0.3 or more. */
    MODERATE,
    /** |r| of 0.2 or more. */
    WEAK,
    NOT_CONFIDENT;

    public static CorrelationConfidence of(int sampleSize, double coefficient)
    {
        double magnitude = Math.abs(coefficient);
        if (sampleSize >= 30 && magnitude >= 0.5) return STRONG;
        if (sampleSize >= 14 && magnitude >= 0.3) return MODERATE;
        if (magnitude >= 0.2) return WEAK;
        return NOT_CONFIDENT;
    }
}
