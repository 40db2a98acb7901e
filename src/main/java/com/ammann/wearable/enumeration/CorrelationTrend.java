package com.ammann.wearable.enumeration;

/**
 * Direction of change of a rolling correlation over time.
 */
public enum CorrelationTrend
{
    STRENGTHENING,
    WEAKENING,
    STABLE,
    /** Fewer than three computable windows. */
    INSUFFICIENT_DATA;

    static final double SLOPE_THRESHOLD = 0.005;

    /**
     * Classifies the least-squares slope of window coefficients per window step.
     */
    public static CorrelationTrend fromSlope(double slope)
    {
        if (Double.isNaN(slope)) return INSUFFICIENT_DATA;
        if (slope > SLOPE_THRESHOLD) return STRENGTHENING;
        if (slope < -SLOPE_THRESHOLD) return WEAKENING;
        return STABLE;
    }
}
