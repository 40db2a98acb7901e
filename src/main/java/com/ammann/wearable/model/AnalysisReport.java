/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.ParticipantRunStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one analysis run over the cohort.
 *
 * <p>{@code statuses} has one entry per participant of the run, including failed and skipped
 * ones; {@code participants} only holds units that finished. The accessors
 * {@link #baselinesByParticipant()}, {@link #correlationsByScope()} and
 * {@link #episodesByParticipant()} expose the three output collections, with an empty list for
 * participants whose unit did not finish.
 */
public record AnalysisReport(
        String runId,
        Instant startedAt,
        Instant completedAt,
        boolean aborted,
        Map<String, ParticipantStatus> statuses,
        Map<String, ParticipantAnalysis> participants,
        List<CorrelationResult> cohortCorrelations) {

    public AnalysisReport {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        participants = Collections.unmodifiableMap(new LinkedHashMap<>(participants));
        cohortCorrelations = List.copyOf(cohortCorrelations);
    }

    public Map<String, List<Baseline>> baselinesByParticipant() {
        Map<String, List<Baseline>> result = new LinkedHashMap<>();
        for (String participantId : statuses.keySet()) {
            ParticipantAnalysis analysis = participants.get(participantId);
            List<Baseline> baselines = new ArrayList<>();
            if (analysis != null) {
                baselines.addAll(analysis.baselines().values());
                baselines.sort(Comparator.comparing(Baseline::metric));
            }
            result.put(participantId, List.copyOf(baselines));
        }
        return result;
    }

    public Map<String, List<CorrelationResult>> correlationsByScope() {
        Map<String, List<CorrelationResult>> result = new LinkedHashMap<>();
        for (String participantId : statuses.keySet()) {
            ParticipantAnalysis analysis = participants.get(participantId);
            result.put(participantId, analysis != null ? analysis.correlations() : List.of());
        }
        result.put(CorrelationResult.COHORT_SCOPE, cohortCorrelations);
        return result;
    }

    public Map<String, List<AnalyzedEpisode>> episodesByParticipant() {
        Map<String, List<AnalyzedEpisode>> result = new LinkedHashMap<>();
        for (String participantId : statuses.keySet()) {
            ParticipantAnalysis analysis = participants.get(participantId);
            result.put(participantId, analysis != null ? analysis.episodes() : List.of());
        }
        return result;
    }

    public long countByStatus(ParticipantRunStatus status) {
        return statuses.values().stream().filter(s -> s.status() == status).count();
    }

    public Baseline baseline(String participantId, MetricType metric) {
        ParticipantAnalysis analysis = participants.get(participantId);
        return analysis != null ? analysis.baselines().get(metric) : null;
    }
}
