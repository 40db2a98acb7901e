/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.dto.AnalysisReportDTO;
import com.ammann.wearable.dto.AnomalyEventDTO;
import com.ammann.wearable.dto.AnomalySummaryDTO;
import com.ammann.wearable.dto.BaselineDTO;
import com.ammann.wearable.dto.CorrelationResultDTO;
import com.ammann.wearable.dto.DriftSignalDTO;
import com.ammann.wearable.dto.ParticipantReportDTO;
import com.ammann.wearable.dto.ParticipantSeriesDTO;
import com.ammann.wearable.dto.ParticipantStatusDTO;
import com.ammann.wearable.dto.ParticipantSummaryDTO;
import com.ammann.wearable.dto.SampleDTO;
import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.SampleQuality;
import com.ammann.wearable.exception.ValidationException;
import com.ammann.wearable.model.AnalysisReport;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.ParticipantAnalysis;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.ParticipantStatus;
import com.ammann.wearable.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Translates between the REST representation and the analysis model.
 *
 * <p>Inbound, samples are grouped per metric in submission order; ordering violations are
 * left for {@link ParticipantSeries#validate()} to report during the run. Outbound, the
 * {@code NaN} sentinels of the model become explicit {@code null} values with a status.
 */
@ApplicationScoped
public class ReportMappingService {

    public ParticipantSeries toModel(ParticipantSeriesDTO dto) {
        if (dto == null) {
            throw ValidationException.missingField("body");
        }
        if (dto.participantId() == null || dto.participantId().isBlank()) {
            throw ValidationException.missingField("participantId");
        }
        if (CorrelationResult.COHORT_SCOPE.equals(dto.participantId())) {
            throw ValidationException.invalidParameter(
                    "participantId",
                    dto.participantId(),
                    "not the reserved scope '" + CorrelationResult.COHORT_SCOPE + "'");
        }
        if (dto.samples() == null) {
            throw ValidationException.missingField("samples");
        }

        String participantId = dto.participantId();
        Map<MetricType, List<Sample>> byMetric = new EnumMap<>(MetricType.class);
        Instant first = null;
        Instant last = null;

        for (SampleDTO sample : dto.samples()) {
            Sample converted = toModel(participantId, sample);
            byMetric.computeIfAbsent(converted.metric(), m -> new ArrayList<>()).add(converted);
            first = first == null || converted.timestamp().isBefore(first) ? converted.timestamp() : first;
            last = last == null || converted.timestamp().isAfter(last) ? converted.timestamp() : last;
        }

        Instant start = dto.monitoringStart() != null ? dto.monitoringStart() : first;
        Instant end = dto.monitoringEnd() != null ? dto.monitoringEnd() : last;
        if (start == null || end == null) {
            throw ValidationException.missingField("monitoringStart/monitoringEnd");
        }
        if (end.isBefore(start)) {
            throw ValidationException.invalidParameter(
                    "monitoringEnd", end, "not before monitoringStart " + start);
        }
        return new ParticipantSeries(participantId, byMetric, start, end);
    }

    private Sample toModel(String participantId, SampleDTO sample) {
        if (sample == null) {
            throw ValidationException.missingField("samples[]");
        }
        if (sample.metric() == null) {
            throw ValidationException.missingField("metric");
        }
        if (sample.timestamp() == null) {
            throw ValidationException.missingField("timestamp");
        }
        if (sample.value() == null || !Double.isFinite(sample.value())) {
            throw ValidationException.invalidParameter("value", sample.value(), "a finite number");
        }
        SampleQuality quality = sample.quality() != null ? sample.quality() : SampleQuality.VALID;
        return new Sample(
                participantId,
                sample.metric(),
                sample.timestamp(),
                sample.value(),
                sample.secondaryValue(),
                quality);
    }

    public AnalysisReportDTO toDto(AnalysisReport report) {
        List<ParticipantStatusDTO> statuses =
                report.statuses().values().stream().map(ParticipantStatusDTO::from).toList();

        Map<String, List<BaselineDTO>> baselines = new LinkedHashMap<>();
        report.baselinesByParticipant()
                .forEach((id, list) -> baselines.put(id, list.stream().map(BaselineDTO::from).toList()));

        Map<String, List<CorrelationResultDTO>> correlations = new LinkedHashMap<>();
        report.correlationsByScope()
                .forEach((scope, list) ->
                        correlations.put(scope, list.stream().map(CorrelationResultDTO::from).toList()));

        Map<String, List<AnomalyEventDTO>> anomalies = new LinkedHashMap<>();
        report.episodesByParticipant()
                .forEach((id, list) -> anomalies.put(id, list.stream().map(AnomalyEventDTO::from).toList()));

        Map<String, ParticipantSummaryDTO> summaries = new LinkedHashMap<>();
        Map<String, List<DriftSignalDTO>> driftSignals = new LinkedHashMap<>();
        Map<String, List<AnomalySummaryDTO>> anomalySummaries = new LinkedHashMap<>();
        for (ParticipantAnalysis analysis : report.participants().values()) {
            summaries.put(analysis.participantId(), ParticipantSummaryDTO.from(analysis.summary()));
            driftSignals.put(analysis.participantId(), map(analysis.driftSignals(), DriftSignalDTO::from));
            anomalySummaries.put(
                    analysis.participantId(), map(analysis.anomalySummaries(), AnomalySummaryDTO::from));
        }

        return new AnalysisReportDTO(
                report.runId(),
                report.startedAt(),
                report.completedAt(),
                report.aborted(),
                statuses,
                baselines,
                correlations,
                anomalies,
                summaries,
                driftSignals,
                anomalySummaries);
    }

    /**
     * One participant's slice of a report, or {@code null} when the participant was not part of
     * the run.
     */
    public ParticipantReportDTO toParticipantDto(AnalysisReport report, String participantId) {
        ParticipantStatus status = report.statuses().get(participantId);
        if (status == null) {
            return null;
        }
        ParticipantAnalysis analysis = report.participants().get(participantId);
        if (analysis == null) {
            return new ParticipantReportDTO(
                    report.runId(), ParticipantStatusDTO.from(status), null,
                    List.of(), List.of(), List.of(), List.of(), List.of());
        }

        List<Baseline> baselines = new ArrayList<>(analysis.baselines().values());
        baselines.sort(Comparator.comparing(Baseline::metric));
        List<CorrelationResult> correlations = analysis.correlations();

        return new ParticipantReportDTO(
                report.runId(),
                ParticipantStatusDTO.from(status),
                ParticipantSummaryDTO.from(analysis.summary()),
                map(baselines, BaselineDTO::from),
                map(correlations, CorrelationResultDTO::from),
                map(analysis.episodes(), AnomalyEventDTO::from),
                map(analysis.driftSignals(), DriftSignalDTO::from),
                map(analysis.anomalySummaries(), AnomalySummaryDTO::from));
    }

    private static <T, R> List<R> map(List<T> source, Function<T, R> mapper) {
        return source.stream().map(mapper).toList();
    }
}
