/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import java.util.List;
import java.util.Map;

/**
 * Everything computed for one participant in a run.
 *
 * <p>{@code dailySeries} is the calendar-day aggregate used by the correlation stage; the
 * cohort reduction reuses it instead of re-reading the raw series.
 */
public record ParticipantAnalysis(
        String participantId,
        ParticipantSummary summary,
        Map<MetricType, Baseline> baselines,
        List<CorrelationResult> correlations,
        List<AnalyzedEpisode> episodes,
        List<DriftSignal> driftSignals,
        List<AnomalySummary> anomalySummaries,
        Map<MetricType, DailySeries> dailySeries) {

    public ParticipantAnalysis {
        baselines = Map.copyOf(baselines);
        correlations = List.copyOf(correlations);
        episodes = List.copyOf(episodes);
        driftSignals = List.copyOf(driftSignals);
        anomalySummaries = List.copyOf(anomalySummaries);
        dailySeries = Map.copyOf(dailySeries);
    }

    /**
     * True when at least one baseline is valid or one correlation is computable.
     */
    public boolean hasFindings() {
        return baselines.values().stream().anyMatch(Baseline::valid)
                || correlations.stream().anyMatch(CorrelationResult::computable);
    }
}
