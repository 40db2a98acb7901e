/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.AnalysisSettings;
import com.ammann.wearable.model.AnalyzedEpisode;
import com.ammann.wearable.model.AnomalyEvent;
import com.ammann.wearable.model.Baseline;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.RecoveryProfile;
import com.ammann.wearable.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Characterises how a metric returns to baseline after an anomaly episode.
 *
 * <p>Recovery is the first run of {@code recoverySustainCount} consecutive in-band samples
 * after the episode end. The recovery duration runs from the episode end to the first sample
 * of that run. If the series ends, or another anomalous sample appears, before such a run is
 * observed, the profile is unresolved: a right-censored observation, not an error.
 */
@ApplicationScoped
public class RecoveryAnalysisService {

    private static final Logger LOG = Logger.getLogger(RecoveryAnalysisService.class);

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final int sustainCount;
    private final AnomalyDetectionService detector;

    @Inject
    public RecoveryAnalysisService(AnalysisSettings settings, AnomalyDetectionService detector) {
        this.sustainCount = settings.recoverySustainCount();
        this.detector = detector;
    }

    /**
     * Builds the recovery profile of one episode.
     *
     * @param series participant series the episode was detected in
     * @param baseline baseline used for detection
     * @param event episode to characterise
     */
    public RecoveryProfile analyze(ParticipantSeries series, Baseline baseline, AnomalyEvent event) {
        List<Sample> samples = series.samples(event.metric());
        List<Sample> trajectory = new ArrayList<>();
        List<Sample> afterEnd = new ArrayList<>();
        Sample runStart = null;
        int run = 0;
        boolean interrupted = false;

        for (Sample sample : samples) {
            Instant ts = sample.timestamp();
            if (ts.isBefore(event.episodeStart())) {
                continue;
            }
            if (!ts.isAfter(event.episodeEnd())) {
                trajectory.add(sample);
                continue;
            }

            if (detector.isAnomalous(baseline.deviation(sample.value()))) {
                interrupted = true;
                break;
            }
            if (runStart == null) {
                runStart = sample;
            }
            afterEnd.add(sample);
            run++;
            if (run >= sustainCount) {
                break;
            }
        }

        if (runStart == null || run < sustainCount) {
            trajectory.addAll(afterEnd);
            double slope = trajectorySlope(event.episodeStart(), trajectory);
            LOG.debugf(
                    "Episode %s/%s at %s unresolved (%s)",
                    event.participantId(),
                    event.metric(),
                    event.episodeStart(),
                    interrupted ? "next episode began" : "series ended");
            return RecoveryProfile.unresolved(event.key(), slope);
        }

        trajectory.add(runStart);
        double slope = trajectorySlope(event.episodeStart(), trajectory);
        Duration duration = Duration.between(event.episodeEnd(), runStart.timestamp());
        return new RecoveryProfile(event.key(), true, duration, runStart.timestamp(), slope);
    }

    /**
     * Attaches recovery profiles to a list of episodes.
     */
    public List<AnalyzedEpisode> analyzeAll(
            ParticipantSeries series, Baseline baseline, List<AnomalyEvent> events) {
        List<AnalyzedEpisode> analyzed = new ArrayList<>(events.size());
        for (AnomalyEvent event : events) {
            analyzed.add(new AnalyzedEpisode(event, analyze(series, baseline, event)));
        }
        return analyzed;
    }

    /**
     * Regression slope of values per day, with time measured from the episode start.
     */
    private static double trajectorySlope(Instant origin, List<Sample> points) {
        double[] x = new double[points.size()];
        double[] y = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            Sample s = points.get(i);
            x[i] = Duration.between(origin, s.timestamp()).getSeconds() / SECONDS_PER_DAY;
            y[i] = s.value();
        }
        return StatisticsSupport.slope(x, y);
    }
}
