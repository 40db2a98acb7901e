package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;

import java.util.List;

/**
 * Per-metric roll-up of anomaly episodes and their recovery.
 *
 * @param anomalousPercentage share of the metric's samples lying outside the band, in percent
 * @param recoveryRate share of episodes that resolved, in percent
 * @param meanRecoveryDays mean recovery duration of resolved episodes, {@code null} if none
 * @param medianRecoveryDays median recovery duration of resolved episodes, {@code null} if none
 * @param clustered more than half of consecutive episode starts lie within three days
 */
public record AnomalySummary(
        MetricType metric,
        int episodeCount,
        double anomalousPercentage,
        double recoveryRate,
        Double meanRecoveryDays,
        Double medianRecoveryDays,
        boolean clustered,
        List<String> insights)
{
    public AnomalySummary
    {
        insights = List.copyOf(insights);
    }
}
