package com.ammann.wearable.dto;

import com.ammann.wearable.enumeration.BaselineStatus;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.HourlyPattern;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Personal baseline of one metric.
 *
 * <p>For an invalid baseline every statistic is {@code null}; {@code status} tells whether
 * there were too few samples or no spread at all.
 */
@Schema(description = "Robust personal baseline of one participant and metric")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record BaselineDTO(
        @Schema(description = "Metric") MetricType metric,
        @Schema(description = "True when center and spread are usable") boolean valid,
        @Schema(description = "VALID, INSUFFICIENT_DATA or DEGENERATE_SERIES") BaselineStatus status,
        @Schema(description = "Samples the baseline was computed from") int sampleCount,
        @Schema(description = "Median of the samples") Double center,
        @Schema(description = "Interquartile range, or scaled MAD when the IQR is zero") Double spread,
        @Schema(description = "Arithmetic mean") Double mean,
        @Schema(description = "Population standard deviation") Double standardDeviation,
        @Schema(description = "10th percentile, lower end of the normal range") Double p10,
        @Schema(description = "25th percentile") Double p25,
        @Schema(description = "75th percentile") Double p75,
        @Schema(description = "90th percentile, upper end of the normal range") Double p90,
        @Schema(description = "Hour of day with the highest mean value") Integer peakHour,
        @Schema(description = "Mean value at the peak hour") Double peakHourValue,
        @Schema(description = "Hour of day with the lowest mean value") Integer lowHour,
        @Schema(description = "Mean value at the low hour") Double lowHourValue,
        @Schema(description = "Baseline center per drift window, chronological") List<DriftPointDTO> driftCurve
) {
    public static BaselineDTO from(Baseline baseline) {
        HourlyPattern hourly = baseline.hourlyPattern() != null ? baseline.hourlyPattern() : HourlyPattern.none();
        return new BaselineDTO(
                baseline.metric(),
                baseline.valid(),
                baseline.status(),
                baseline.sampleCount(),
                DtoValues.finiteOrNull(baseline.center()),
                DtoValues.finiteOrNull(baseline.spread()),
                DtoValues.finiteOrNull(baseline.mean()),
                DtoValues.finiteOrNull(baseline.standardDeviation()),
                DtoValues.finiteOrNull(baseline.p10()),
                DtoValues.finiteOrNull(baseline.p25()),
                DtoValues.finiteOrNull(baseline.p75()),
                DtoValues.finiteOrNull(baseline.p90()),
                hourly.peakHour(),
                hourly.peakValue(),
                hourly.lowHour(),
                hourly.lowValue(),
                baseline.driftCurve().stream().map(DriftPointDTO::from).toList());
    }
}
