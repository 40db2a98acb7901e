/* (C)2026 */
package com.ammann.wearable.enumeration;

/**
 * Severity of an anomaly episode, derived from the magnitude of its peak deviation
 * expressed in multiples of the baseline spread.
 */
public enum Severity {
    MILD,
    MODERATE,
    SEVERE;

    /**
     * Classifies a peak deviation.
     *
     * @param peakDeviation signed deviation in spread multiples
     * @param moderateMultiplier lowest magnitude classified as {@link #MODERATE}
     * @param severeMultiplier lowest magnitude classified as {@link #SEVERE}
     * @return the severity for the magnitude of the deviation
     */
    public static Severity fromDeviation(
            double peakDeviation, double moderateMultiplier, double severeMultiplier) {
        double magnitude = Math.abs(peakDeviation);
        if (magnitude >= severeMultiplier) return SEVERE;
        if (magnitude >= moderateMultiplier) return MODERATE;
        return MILD;
    }
}
