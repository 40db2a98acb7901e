/* (C)2026 */
package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.CorrelationConfidence;
import com.ammann.wearable.enumeration.CorrelationKind;
import com.ammann.wearable.enumeration.CorrelationMethod;
import com.ammann.wearable.enumeration.CorrelationTrend;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.NotComputableReason;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.RollingTrend;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Correlation of one metric pair under one regime and estimator.
 *
 * <p>A statistic that could not be computed is reported as {@code coefficient: null} with
 * {@code status: NOT_COMPUTABLE} and a {@code reason}, never as zero.
 */
@Schema(description = "Correlation result for one metric pair, regime and estimator")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CorrelationResultDTO(
        @Schema(description = "Participant id or 'cohort'") String scope,
        @Schema(description = "First metric of the pair") MetricType firstMetric,
        @Schema(description = "Second metric of the pair") MetricType secondMetric,
        @Schema(description = "Pair label, e.g. HR_vs_STEPS") String pair,
        @Schema(description = "DAILY, LAG1 or ROLLING") CorrelationKind kind,
        @Schema(description = "PEARSON or SPEARMAN") CorrelationMethod method,
        @Schema(description = "COMPUTED or NOT_COMPUTABLE") String status,
        @Schema(description = "Coefficient in [-1, 1], null when not computable") Double coefficient,
        @Schema(description = "Why the coefficient is missing") NotComputableReason reason,
        @Schema(description = "Aligned days, or computable windows for ROLLING") int sampleSize,
        @Schema(description = "Two-sided p-value") Double pValue,
        @Schema(description = "p-value below 0.05") boolean significant,
        @Schema(description = "Confidence label") CorrelationConfidence confidence,
        @Schema(description = "Human-readable interpretation") String interpretation,
        @Schema(description = "Participants contributing observations") int participantCount,
        @Schema(description = "Trend of the rolling coefficients") CorrelationTrend trend,
        @Schema(description = "Least-squares slope of the rolling coefficients per window") Double trendSlope,
        @Schema(description = "Standard deviation of the rolling coefficients") Double windowStandardDeviation,
        @Schema(description = "Rolling windows, empty for other regimes") List<RollingWindowDTO> windows
) {
    public static final String COMPUTED = "COMPUTED";
    public static final String NOT_COMPUTABLE = "NOT_COMPUTABLE";

    public static CorrelationResultDTO from(CorrelationResult result) {
        RollingTrend trend = result.trend();
        return new CorrelationResultDTO(
                result.scope(),
                result.pair().first(),
                result.pair().second(),
                result.pair().label(),
                result.kind(),
                result.method(),
                result.computable() ? COMPUTED : NOT_COMPUTABLE,
                DtoValues.finiteOrNull(result.coefficient()),
                result.reason(),
                result.sampleSize(),
                DtoValues.finiteOrNull(result.pValue()),
                result.significant(),
                result.confidence(),
                result.interpretation(),
                result.participantCount(),
                trend != null ? trend.trend() : null,
                trend != null ? DtoValues.finiteOrNull(trend.slope()) : null,
                trend != null ? DtoValues.finiteOrNull(trend.standardDeviation()) : null,
                result.windows().stream().map(RollingWindowDTO::from).toList());
    }
}
