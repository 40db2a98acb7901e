/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.exception.MisalignedInputException;
import com.ammann.wearable.model.AnalyzedEpisode;
import com.ammann.wearable.model.AnomalyEvent;
import com.ammann.wearable.model.AnomalySummary;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.DailySeries;
import com.ammann.wearable.model.DriftSignal;
import com.ammann.wearable.model.ParticipantAnalysis;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.ParticipantSummary;
import com.ammann.wearable.service.DailyAlignmentService.DaySpan;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Runs the complete analysis of a single participant: baselines, correlations, anomaly
 * episodes with recovery, drift signals and summaries.
 *
 * <p>Reads only the given participant's series and keeps no state between calls, so units
 * for different participants can run concurrently.
 */
@ApplicationScoped
public class ParticipantAnalysisService {

    private static final Logger LOG = Logger.getLogger(ParticipantAnalysisService.class);

    private final BaselineService baselineService;
    private final DailyAlignmentService alignmentService;
    private final CorrelationService correlationService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final RecoveryAnalysisService recoveryAnalysisService;
    private final AnomalyInsightService anomalyInsightService;

    @Inject
    public ParticipantAnalysisService(
            BaselineService baselineService,
            DailyAlignmentService alignmentService,
            CorrelationService correlationService,
            AnomalyDetectionService anomalyDetectionService,
            RecoveryAnalysisService recoveryAnalysisService,
            AnomalyInsightService anomalyInsightService) {
        this.baselineService = baselineService;
        this.alignmentService = alignmentService;
        this.correlationService = correlationService;
        this.anomalyDetectionService = anomalyDetectionService;
        this.recoveryAnalysisService = recoveryAnalysisService;
        this.anomalyInsightService = anomalyInsightService;
    }

    /**
     * Analyses one participant.
     *
     * @param series participant series
     * @return all findings of the participant
     * @throws MisalignedInputException if the series violates the input contract
     */
    public ParticipantAnalysis analyze(ParticipantSeries series) {
        series.validate();
        String participantId = series.participantId();

        Map<MetricType, Baseline> baselines = baselineService.computeAll(series);
        Map<MetricType, DailySeries> daily = alignmentService.aggregateAll(series);
        List<CorrelationResult> correlations =
                correlationService.correlateParticipant(participantId, daily);

        List<AnalyzedEpisode> episodes = new ArrayList<>();
        List<DriftSignal> driftSignals = new ArrayList<>();
        List<AnomalySummary> summaries = new ArrayList<>();

        for (Baseline baseline : baselines.values()) {
            if (!baseline.valid()) {
                continue;
            }
            List<AnomalyEvent> events = anomalyDetectionService.detect(series, baseline);
            List<AnalyzedEpisode> analyzed =
                    recoveryAnalysisService.analyzeAll(series, baseline, events);

            episodes.addAll(analyzed);
            driftSignals.addAll(anomalyDetectionService.detectDrift(baseline));
            summaries.add(
                    anomalyInsightService.summarize(
                            baseline.metric(), baseline.sampleCount(), analyzed));
        }

        ParticipantSummary summary = summarize(daily);

        LOG.debugf(
                "Participant %s analysed: %d valid baselines, %d episodes, %d drift signals",
                participantId,
                baselines.values().stream().filter(Baseline::valid).count(),
                episodes.size(),
                driftSignals.size());

        return new ParticipantAnalysis(
                participantId,
                summary,
                baselines,
                correlations,
                episodes,
                driftSignals,
                summaries,
                daily);
    }

    ParticipantSummary summarize(Map<MetricType, DailySeries> daily) {
        DaySpan span = alignmentService.span(List.copyOf(daily.values()));
        List<MetricType> available = new ArrayList<>();
        Map<MetricType, Double> coverage = new EnumMap<>(MetricType.class);
        if (span == null) {
            return new ParticipantSummary(null, null, 0, available, coverage);
        }

        for (Map.Entry<MetricType, DailySeries> entry : daily.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            available.add(entry.getKey());
            coverage.put(entry.getKey(), (double) entry.getValue().dayCount() / span.totalDays());
        }
        return new ParticipantSummary(span.first(), span.last(), span.totalDays(), available, coverage);
    }
}
