/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.BaselineStatus;
import com.ammann.wearable.enumeration.MetricType;
import java.util.List;

/**
 * Personal normal range of one metric for one participant.
 *
 * <p>{@code center} is the median and {@code spread} the interquartile range of the full
 * history (scaled median absolute deviation when the IQR collapses to zero). When the status
 * is not {@link BaselineStatus#VALID} every statistic is {@code NaN} and must not be used;
 * consumers check {@link #valid()} first.
 */
public record Baseline(
        String participantId,
        MetricType metric,
        BaselineStatus status,
        int sampleCount,
        double center,
        double spread,
        double mean,
        double standardDeviation,
        double p10,
        double p25,
        double p75,
        double p90,
        HourlyPattern hourlyPattern,
        List<DriftPoint> driftCurve) {

    public Baseline {
        driftCurve = List.copyOf(driftCurve);
    }

    /**
     * Creates a baseline that carries no usable statistics.
     */
    public static Baseline invalid(
            String participantId, MetricType metric, BaselineStatus status, int sampleCount) {
        if (status.isValid()) {
            throw new IllegalArgumentException("Invalid baseline cannot have status VALID");
        }
        return new Baseline(
                participantId,
                metric,
                status,
                sampleCount,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                Double.NaN,
                HourlyPattern.none(),
                List.of());
    }

    public boolean valid() {
        return status.isValid();
    }

    /** Signed deviation of a value from the center in spread multiples. */
    public double deviation(double value) {
        return (value - center) / spread;
    }

    public double lowerBound(double multiplier) {
        return center - multiplier * spread;
    }

    public double upperBound(double multiplier) {
        return center + multiplier * spread;
    }
}
