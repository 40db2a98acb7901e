/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.Severity;
import java.time.Instant;
import java.util.List;

/**
 * A gap-tolerant run of out-of-baseline samples of one metric.
 *
 * <p>{@code samples} spans the episode from its first to its last anomalous sample and
 * includes the in-band readings tolerated in between. {@code closed} is set when the series
 * returned to the baseline band for the sustain count after {@code episodeEnd}; an episode
 * cut short by the end of the series or a data gap stays open.
 *
 * @param peakDeviation signed deviation of the most extreme sample in spread multiples
 * @param anomalousSampleCount samples in the episode that lie outside the band
 */
public record AnomalyEvent(
        String participantId,
        MetricType metric,
        Instant episodeStart,
        Instant episodeEnd,
        double peakDeviation,
        Severity severity,
        List<Sample> samples,
        int anomalousSampleCount,
        boolean closed) {

    public AnomalyEvent {
        samples = List.copyOf(samples);
    }

    /** Lookup key used by recovery profiles. */
    public EpisodeKey key() {
        return new EpisodeKey(participantId, metric, episodeStart);
    }

    /**
     * Identifies an episode without holding on to it.
     */
    public record EpisodeKey(String participantId, MetricType metric, Instant episodeStart) {}
}
