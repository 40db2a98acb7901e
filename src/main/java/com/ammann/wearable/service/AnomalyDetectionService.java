/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.enumeration.Severity;
import com.ammann.wearable.model.AnomalyEvent;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.DriftPoint;
import com.ammann.wearable.model.DriftSignal;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Flags deviations from a participant's baseline and groups them into episodes.
 *
 * <p>A sample is anomalous when {@code |value - center| > deviationMultiplier * spread}. The
 * series is scanned chronologically:
 * <ul>
 *   <li>an anomalous sample opens an episode, or extends the open one;</li>
 *   <li>in-band samples inside an open episode are tolerated until {@code recoverySustainCount}
 *       of them follow each other, which closes the episode at its last anomalous sample;</li>
 *   <li>two anomalous samples further apart in time than {@code episodeGapTolerance} are never
 *       merged: the open episode ends without having closed and a new one starts;</li>
 *   <li>an episode still open when the series ends stays unclosed.</li>
 * </ul>
 * Episodes are therefore chronological and non-overlapping. The scan is deterministic, so
 * identical input yields identical episodes.
 */
@ApplicationScoped
public class AnomalyDetectionService {

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    private final double deviationMultiplier;
    private final double moderateMultiplier;
    private final double severeMultiplier;
    private final Duration gapTolerance;
    private final int sustainCount;
    private final double driftFraction;

    @Inject
    public AnomalyDetectionService(AnalysisSettings settings) {
        this.deviationMultiplier = settings.deviationMultiplier();
        this.moderateMultiplier = settings.moderateMultiplier();
        this.severeMultiplier = settings.severeMultiplier();
        this.gapTolerance = settings.episodeGapTolerance();
        this.sustainCount = settings.recoverySustainCount();
        this.driftFraction = settings.driftFraction();
    }

    /**
     * Detects anomaly episodes of the baseline's metric.
     *
     * @param series participant series
     * @param baseline baseline of the same participant and metric
     * @return chronologically ordered episodes; empty when the baseline is not valid
     */
    public List<AnomalyEvent> detect(ParticipantSeries series, Baseline baseline) {
        if (!baseline.valid()) {
            LOG.debugf(
                    "Skipping anomaly detection for %s/%s: baseline %s",
                    baseline.participantId(), baseline.metric(), baseline.status());
            return List.of();
        }

        List<Sample> samples = series.samples(baseline.metric());
        List<AnomalyEvent> events = new ArrayList<>();
        EpisodeBuilder open = null;
        int inBandRun = 0;

        for (Sample sample : samples) {
            double deviation = baseline.deviation(sample.value());
            boolean anomalous = isAnomalous(deviation);

            if (anomalous) {
                if (open != null && exceedsGap(open.lastAnomalous, sample)) {
                    events.add(open.build(baseline, false));
                    open = null;
                }
                if (open == null) {
                    open = new EpisodeBuilder();
                }
                open.addAnomalous(sample, deviation);
                inBandRun = 0;
            } else if (open != null) {
                open.addInBand(sample);
                inBandRun++;
                if (inBandRun >= sustainCount) {
                    events.add(open.build(baseline, true));
                    open = null;
                    inBandRun = 0;
                }
            }
        }

        if (open != null) {
            events.add(open.build(baseline, false));
        }

        if (!events.isEmpty()) {
            LOG.debugf(
                    "Detected %d anomaly episodes for %s/%s",
                    events.size(), baseline.participantId(), baseline.metric());
        }
        return List.copyOf(events);
    }

    /**
     * Flags adjacent drift-curve windows whose centers differ by more than
     * {@code driftFraction * spread}. Windows left out of the curve for too few samples are not
     * bridged: the points on either side of such a gap are never compared.
     *
     * @param baseline baseline with its drift curve
     * @return drift signals in chronological order; empty for invalid baselines
     */
    public List<DriftSignal> detectDrift(Baseline baseline) {
        if (!baseline.valid()) {
            return List.of();
        }

        List<DriftPoint> curve = baseline.driftCurve();
        double threshold = driftFraction * baseline.spread();
        List<DriftSignal> signals = new ArrayList<>();

        for (int i = 1; i < curve.size(); i++) {
            DriftPoint previous = curve.get(i - 1);
            DriftPoint current = curve.get(i);
            if (!current.windowStart().equals(previous.windowEnd().plusDays(1))) {
                continue;
            }
            double shift = current.center() - previous.center();

            if (Math.abs(shift) > threshold) {
                signals.add(
                        new DriftSignal(
                                baseline.participantId(),
                                baseline.metric(),
                                previous.windowStart(),
                                current.windowStart(),
                                previous.center(),
                                current.center(),
                                shift,
                                shift / baseline.spread()));
            }
        }

        if (!signals.isEmpty()) {
            LOG.infof(
                    "Baseline drift for %s/%s: %d window shifts above %.2f",
                    baseline.participantId(), baseline.metric(), signals.size(), threshold);
        }
        return List.copyOf(signals);
    }

    /**
     * Whether a deviation expressed in spread multiples lies outside the baseline band.
     */
    public boolean isAnomalous(double deviation) {
        return Math.abs(deviation) > deviationMultiplier;
    }

    private boolean exceedsGap(Sample previous, Sample current) {
        return Duration.between(previous.timestamp(), current.timestamp()).compareTo(gapTolerance) > 0;
    }

    /**
     * Accumulates one episode. In-band samples are held back until the next anomalous sample
     * confirms they lie inside the episode.
     */
    private final class EpisodeBuilder {
        private final List<Sample> samples = new ArrayList<>();
        private final List<Sample> pendingInBand = new ArrayList<>();
        private Sample lastAnomalous;
        private double peakDeviation;
        private int anomalousCount;

        void addAnomalous(Sample sample, double deviation) {
            samples.addAll(pendingInBand);
            pendingInBand.clear();
            samples.add(sample);
            lastAnomalous = sample;
            anomalousCount++;
            if (Math.abs(deviation) > Math.abs(peakDeviation)) {
                peakDeviation = deviation;
            }
        }

        void addInBand(Sample sample) {
            pendingInBand.add(sample);
        }

        AnomalyEvent build(Baseline baseline, boolean closed) {
            return new AnomalyEvent(
                    baseline.participantId(),
                    baseline.metric(),
                    samples.get(0).timestamp(),
                    lastAnomalous.timestamp(),
                    peakDeviation,
                    Severity.fromDeviation(peakDeviation, moderateMultiplier, severeMultiplier),
                    samples,
                    anomalousCount,
                    closed);
        }
    }
}
