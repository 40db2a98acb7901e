package com.ammann.wearable.service;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.model.AnalyzedEpisode;
import com.ammann.wearable.model.AnomalySummary;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rolls up the episodes of one metric into frequency, recovery and clustering figures with
 * short textual insights for the reporting layer.
 */
@ApplicationScoped
public class AnomalyInsightService
{
    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final long CLUSTER_WINDOW_DAYS = 3;

    /**
     * Summarises the episodes of one metric.
     *
     * @param metric metric the episodes belong to
     * @param sampleCount total samples of the metric
     * @param episodes episodes with recovery profiles, chronological
     */
    public AnomalySummary summarize(MetricType metric, int sampleCount, List<AnalyzedEpisode> episodes)
    {
        int anomalousSamples = episodes.stream().mapToInt(e -> e.event().anomalousSampleCount()).sum();
        double anomalousPercentage = sampleCount > 0 ? 100.0 * anomalousSamples / sampleCount : 0.0;

        double[] recoveryDays = episodes.stream()
                .filter(e -> e.recovery().resolved())
                .mapToDouble(e -> e.recovery().recoveryDuration().getSeconds() / SECONDS_PER_DAY)
                .toArray();

        double recoveryRate = episodes.isEmpty() ? 0.0 : 100.0 * recoveryDays.length / episodes.size();
        Double meanDays = recoveryDays.length > 0 ? StatisticsSupport.mean(recoveryDays) : null;
        Double medianDays = recoveryDays.length > 0 ? StatisticsSupport.median(recoveryDays) : null;
        boolean clustered = isClustered(episodes);

        List<String> insights = new ArrayList<>();
        if (episodes.isEmpty()) {
            insights.add(String.format(Locale.ROOT, "No %s anomalies detected", metric));
        } else {
            insights.add(frequencyInsight(metric, anomalousPercentage));
            insights.add(recoveryInsight(recoveryRate, meanDays));
            if (clustered) {
                insights.add("Anomalies tend to cluster together");
            }
        }

        return new AnomalySummary(
                metric, episodes.size(), anomalousPercentage, recoveryRate, meanDays, medianDays, clustered, insights);
    }

    /**
     * More than half of the gaps between consecutive episode starts are at most three days.
     */
    boolean isClustered(List<AnalyzedEpisode> episodes)
    {
        if (episodes.size() < 2) {
            return false;
        }
        int close = 0;
        for (int i = 1; i < episodes.size(); i++) {
            Duration gap = Duration.between(
                    episodes.get(i - 1).event().episodeStart(), episodes.get(i).event().episodeStart());
            if (gap.toDays() <= CLUSTER_WINDOW_DAYS) {
                close++;
            }
        }
        return close > (episodes.size() - 1) * 0.5;
    }

    private static String frequencyInsight(MetricType metric, double percentage)
    {
        String frequency = percentage > 15 ? "Frequent" : percentage > 5 ? "Occasional" : "Rare";
        return String.format(Locale.ROOT, "%s %s anomalies detected (%.0f%% of readings)", frequency, metric, percentage);
    }

    private static String recoveryInsight(double recoveryRate, Double meanDays)
    {
        if (meanDays == null) {
            return "No recovery to baseline observed yet";
        }
        if (recoveryRate > 80) {
            return String.format(Locale.ROOT, "Quick recovery typical (average %.1f days)", meanDays);
        }
        if (recoveryRate > 50) {
            return String.format(Locale.ROOT, "Moderate recovery patterns (average %.1f days)", meanDays);
        }
        return "Slow or incomplete recovery from anomalies";
    }
}
