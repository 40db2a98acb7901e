/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.exception.MisalignedInputException;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of one participant's cleaned time series, keyed by metric.
 *
 * <p>Instances are owned by the {@link com.ammann.wearable.service.TimeSeriesStore}; analysis
 * components only read them. The sample lists are copied on construction and exposed as
 * unmodifiable lists. Contract violations are reported by {@link #validate()} rather than
 * the constructor so that a broken series fails only its own analysis unit.
 */
public final class ParticipantSeries {

    private final String participantId;
    private final Map<MetricType, List<Sample>> samples;
    private final Instant monitoringStart;
    private final Instant monitoringEnd;

    public ParticipantSeries(
            String participantId,
            Map<MetricType, List<Sample>> samples,
            Instant monitoringStart,
            Instant monitoringEnd) {
        this.participantId = Objects.requireNonNull(participantId, "participantId");
        this.monitoringStart = Objects.requireNonNull(monitoringStart, "monitoringStart");
        this.monitoringEnd = Objects.requireNonNull(monitoringEnd, "monitoringEnd");

        EnumMap<MetricType, List<Sample>> copy = new EnumMap<>(MetricType.class);
        samples.forEach((metric, list) -> copy.put(metric, List.copyOf(list)));
        this.samples = Collections.unmodifiableMap(copy);
    }

    public String participantId() {
        return participantId;
    }

    public Instant monitoringStart() {
        return monitoringStart;
    }

    public Instant monitoringEnd() {
        return monitoringEnd;
    }

    /**
     * Returns the ordered samples of one metric, or an empty list when the metric was not
     * recorded.
     */
    public List<Sample> samples(MetricType metric) {
        return samples.getOrDefault(metric, List.of());
    }

    /** Metrics with at least one sample. */
    public Set<MetricType> metrics() {
        return samples.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(MetricType.class)));
    }

    public int totalSamples() {
        return samples.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Checks the input contract: the id is not the reserved {@link CorrelationResult#COHORT_SCOPE},
     * every sample belongs to this participant and to the metric it is filed under, lies within
     * the monitoring window, and timestamps are strictly increasing per metric.
     *
     * @throws MisalignedInputException on the first violation found
     */
    public void validate() {
        if (CorrelationResult.COHORT_SCOPE.equals(participantId)) {
            throw MisalignedInputException.reservedParticipantId(participantId);
        }
        if (monitoringEnd.isBefore(monitoringStart)) {
            throw new MisalignedInputException(
                    participantId,
                    String.format(
                            "monitoring end %s precedes start %s", monitoringEnd, monitoringStart));
        }

        for (Map.Entry<MetricType, List<Sample>> entry : samples.entrySet()) {
            MetricType metric = entry.getKey();
            Instant previous = null;

            for (Sample sample : entry.getValue()) {
                if (!participantId.equals(sample.participantId())) {
                    throw MisalignedInputException.participantMismatch(
                            participantId, sample.participantId());
                }
                if (sample.metric() != metric) {
                    throw MisalignedInputException.metricMismatch(
                            participantId, metric, sample.metric());
                }
                Instant ts = sample.timestamp();
                if (ts.isBefore(monitoringStart) || ts.isAfter(monitoringEnd)) {
                    throw MisalignedInputException.outsideMonitoringWindow(
                            participantId, metric, ts, monitoringStart, monitoringEnd);
                }
                if (previous != null && !ts.isAfter(previous)) {
                    throw MisalignedInputException.notIncreasing(participantId, metric, previous, ts);
                }
                previous = ts;
            }
        }
    }

    @Override
    public String toString() {
        return "ParticipantSeries{participantId='"
                + participantId
                + "', metrics="
                + metrics()
                + ", samples="
                + totalSamples()
                + '}';
    }
}
