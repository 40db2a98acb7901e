/* (C)2026 */
package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.enumeration.SampleQuality;
import java.time.Instant;
import java.util.Objects;

/**
 * One cleaned reading of a single metric for a single participant.
 *
 * @param participantId owning participant
 * @param metric metric the value belongs to
 * @param timestamp time of the reading
 * @param value primary value (systolic pressure, step count, heart rate, ...)
 * @param secondaryValue optional secondary value such as sleep quality, {@code null} if absent
 * @param quality cleaning outcome of the reading
 */
public record Sample(
        String participantId,
        MetricType metric,
        Instant timestamp,
        double value,
        Double secondaryValue,
        SampleQuality quality) {

    public Sample {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(quality, "quality");
    }

    public static Sample of(String participantId, MetricType metric, Instant timestamp, double value) {
        return new Sample(participantId, metric, timestamp, value, null, SampleQuality.VALID);
    }
}
