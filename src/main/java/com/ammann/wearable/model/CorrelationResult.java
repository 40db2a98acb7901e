/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.CorrelationConfidence;
import com.ammann.wearable.enumeration.CorrelationKind;
import com.ammann.wearable.enumeration.CorrelationMethod;
import com.ammann.wearable.enumeration.NotComputableReason;
import java.util.List;

/**
 * Correlation of one metric pair under one regime and estimator.
 *
 * <p>A coefficient of {@link #NOT_COMPUTABLE} ({@code NaN}) is the explicit sentinel for a
 * statistic that could not be computed; {@link #reason()} then says why. For
 * {@link CorrelationKind#ROLLING} the coefficient is the mean over computable windows,
 * {@code sampleSize} is the number of computable windows, and {@link #windows()} holds the
 * time-indexed series. Other kinds have an empty window list and a {@code null} trend.
 *
 * @param scope participant id or {@link #COHORT_SCOPE}
 * @param participantCount participants contributing observations, 1 for participant scope
 */
public record CorrelationResult(
        String scope,
        MetricPair pair,
        CorrelationKind kind,
        CorrelationMethod method,
        double coefficient,
        NotComputableReason reason,
        int sampleSize,
        double pValue,
        CorrelationConfidence confidence,
        String interpretation,
        List<RollingWindow> windows,
        RollingTrend trend,
        int participantCount) {

    public static final double NOT_COMPUTABLE = Double.NaN;
    public static final String COHORT_SCOPE = "cohort";
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    public CorrelationResult {
        windows = List.copyOf(windows);
    }

    public boolean computable() {
        return !Double.isNaN(coefficient);
    }

    public boolean significant() {
        return computable() && !Double.isNaN(pValue) && pValue < SIGNIFICANCE_LEVEL;
    }

    public boolean isCohort() {
        return COHORT_SCOPE.equals(scope);
    }
}
