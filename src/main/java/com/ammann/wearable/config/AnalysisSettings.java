/* (C)2026 */
package com.ammann.wearable.config;

import com.ammann.wearable.exception.ConfigurationException;
import com.ammann.wearable.model.MetricPair;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Immutable thresholds and windows consumed by the analysis components.
 *
 * <p>Built once at startup by {@link AnalysisSettingsProducer} from
 * {@code wearable.analysis.*} properties and passed into each service at construction.
 * {@link #validate()} rejects inconsistent values with a {@link ConfigurationException}.
 *
 * @param metricPairs pairs to correlate
 * @param baselineMinSamples samples required for a valid baseline
 * @param driftWindowDays length of the non-overlapping drift windows in days
 * @param driftMinWindowSamples samples a drift window needs to contribute a point
 * @param correlationMinAlignedDays aligned days required for a correlation
 * @param rollingWindowDays length of the rolling correlation window in days
 * @param deviationMultiplier spread multiple beyond which a sample is anomalous
 * @param moderateMultiplier spread multiple from which an episode is MODERATE
 * @param severeMultiplier spread multiple from which an episode is SEVERE
 * @param episodeGapTolerance longest time between two anomalous samples of one episode
 * @param driftFraction spread fraction a drift-curve step must exceed to be signalled
 * @param recoverySustainCount consecutive in-band samples that close an episode
 * @param zone time zone defining calendar days
 * @param workers upper bound of concurrently analysed participants
 */
public record AnalysisSettings(
        List<MetricPair> metricPairs,
        int baselineMinSamples,
        int driftWindowDays,
        int driftMinWindowSamples,
        int correlationMinAlignedDays,
        int rollingWindowDays,
        double deviationMultiplier,
        double moderateMultiplier,
        double severeMultiplier,
        Duration episodeGapTolerance,
        double driftFraction,
        int recoverySustainCount,
        ZoneId zone,
        int workers) {

    public static final int DEFAULT_BASELINE_MIN_SAMPLES = 14;
    public static final int DEFAULT_DRIFT_WINDOW_DAYS = 14;
    public static final int DEFAULT_DRIFT_MIN_WINDOW_SAMPLES = 3;
    public static final int DEFAULT_CORRELATION_MIN_ALIGNED_DAYS = 10;
    public static final int DEFAULT_ROLLING_WINDOW_DAYS = 14;
    public static final double DEFAULT_DEVIATION_MULTIPLIER = 2.5;
    public static final double DEFAULT_MODERATE_MULTIPLIER = 3.0;
    public static final double DEFAULT_SEVERE_MULTIPLIER = 5.0;
    public static final Duration DEFAULT_EPISODE_GAP_TOLERANCE = Duration.ofDays(2);
    public static final double DEFAULT_DRIFT_FRACTION = 0.5;
    public static final int DEFAULT_RECOVERY_SUSTAIN_COUNT = 2;
    public static final int DEFAULT_WORKERS = 4;

    public AnalysisSettings {
        metricPairs = metricPairs == null ? List.of() : List.copyOf(metricPairs);
    }

    public static AnalysisSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .metricPairs(metricPairs)
                .baselineMinSamples(baselineMinSamples)
                .driftWindowDays(driftWindowDays)
                .driftMinWindowSamples(driftMinWindowSamples)
                .correlationMinAlignedDays(correlationMinAlignedDays)
                .rollingWindowDays(rollingWindowDays)
                .deviationMultiplier(deviationMultiplier)
                .moderateMultiplier(moderateMultiplier)
                .severeMultiplier(severeMultiplier)
                .episodeGapTolerance(episodeGapTolerance)
                .driftFraction(driftFraction)
                .recoverySustainCount(recoverySustainCount)
                .zone(zone)
                .workers(workers);
    }

    /**
     * Checks internal consistency of all values.
     *
     * @return this instance, for chaining
     * @throws ConfigurationException describing the first invalid value
     */
    public AnalysisSettings validate() {
        if (metricPairs.isEmpty()) {
            throw ConfigurationException.invalidSetting("metric-pairs", metricPairs, "at least one pair");
        }
        requireAtLeast("baseline.min-samples", baselineMinSamples, 2);
        requireAtLeast("baseline.drift-window-days", driftWindowDays, 1);
        requireAtLeast("baseline.drift-min-window-samples", driftMinWindowSamples, 1);
        requireAtLeast("correlation.min-aligned-days", correlationMinAlignedDays, 3);
        requireAtLeast("correlation.rolling-window-days", rollingWindowDays, correlationMinAlignedDays);
        requireAtLeast("recovery.sustain-count", recoverySustainCount, 1);
        requireAtLeast("workers", workers, 1);

        if (!(deviationMultiplier > 0) || Double.isInfinite(deviationMultiplier)) {
            throw ConfigurationException.invalidSetting(
                    "anomaly.deviation-multiplier", deviationMultiplier, "a positive finite number");
        }
        if (!(moderateMultiplier > deviationMultiplier)) {
            throw ConfigurationException.invalidSetting(
                    "anomaly.moderate-multiplier",
                    moderateMultiplier,
                    "a value above the deviation multiplier " + deviationMultiplier);
        }
        if (!(severeMultiplier > moderateMultiplier) || Double.isInfinite(severeMultiplier)) {
            throw ConfigurationException.invalidSetting(
                    "anomaly.severe-multiplier",
                    severeMultiplier,
                    "a finite value above the moderate multiplier " + moderateMultiplier);
        }
        if (!(driftFraction > 0) || Double.isInfinite(driftFraction)) {
            throw ConfigurationException.invalidSetting(
                    "anomaly.drift-fraction", driftFraction, "a positive finite number");
        }
        if (episodeGapTolerance == null
                || episodeGapTolerance.isNegative()
                || episodeGapTolerance.isZero()) {
            throw ConfigurationException.invalidSetting(
                    "anomaly.episode-gap-tolerance", episodeGapTolerance, "a positive duration");
        }
        if (zone == null) {
            throw ConfigurationException.invalidSetting("zone", null, "a time zone id");
        }
        return this;
    }

    private static void requireAtLeast(String name, int value, int minimum) {
        if (value < minimum) {
            throw ConfigurationException.invalidSetting(name, value, "at least " + minimum);
        }
    }

    /**
     * Fluent builder pre-populated with the defaults.
     */
    public static final class Builder {
        private List<MetricPair> metricPairs = MetricPair.defaultPairs();
        private int baselineMinSamples = DEFAULT_BASELINE_MIN_SAMPLES;
        private int driftWindowDays = DEFAULT_DRIFT_WINDOW_DAYS;
        private int driftMinWindowSamples = DEFAULT_DRIFT_MIN_WINDOW_SAMPLES;
        private int correlationMinAlignedDays = DEFAULT_CORRELATION_MIN_ALIGNED_DAYS;
        private int rollingWindowDays = DEFAULT_ROLLING_WINDOW_DAYS;
        private double deviationMultiplier = DEFAULT_DEVIATION_MULTIPLIER;
        private double moderateMultiplier = DEFAULT_MODERATE_MULTIPLIER;
        private double severeMultiplier = DEFAULT_SEVERE_MULTIPLIER;
        private Duration episodeGapTolerance = DEFAULT_EPISODE_GAP_TOLERANCE;
        private double driftFraction = DEFAULT_DRIFT_FRACTION;
        private int recoverySustainCount = DEFAULT_RECOVERY_SUSTAIN_COUNT;
        private ZoneId zone = ZoneOffset.UTC;
        private int workers = DEFAULT_WORKERS;

        private Builder() {}

        public Builder metricPairs(List<MetricPair> metricPairs) {
            this.metricPairs = Objects.requireNonNull(metricPairs);
            return this;
        }

        public Builder baselineMinSamples(int baselineMinSamples) {
            this.baselineMinSamples = baselineMinSamples;
            return this;
        }

        public Builder driftWindowDays(int driftWindowDays) {
            this.driftWindowDays = driftWindowDays;
            return this;
        }

        public Builder driftMinWindowSamples(int driftMinWindowSamples) {
            this.driftMinWindowSamples = driftMinWindowSamples;
            return this;
        }

        public Builder correlationMinAlignedDays(int correlationMinAlignedDays) {
            this.correlationMinAlignedDays = correlationMinAlignedDays;
            return this;
        }

        public Builder rollingWindowDays(int rollingWindowDays) {
            this.rollingWindowDays = rollingWindowDays;
            return this;
        }

        public Builder deviationMultiplier(double deviationMultiplier) {
            this.deviationMultiplier = deviationMultiplier;
            return this;
        }

        public Builder moderateMultiplier(double moderateMultiplier) {
            this.moderateMultiplier = moderateMultiplier;
            return this;
        }

        public Builder severeMultiplier(double severeMultiplier) {
            this.severeMultiplier = severeMultiplier;
            return this;
        }

        public Builder episodeGapTolerance(Duration episodeGapTolerance) {
            this.episodeGapTolerance = episodeGapTolerance;
            return this;
        }

        public Builder driftFraction(double driftFraction) {
            this.driftFraction = driftFraction;
            return this;
        }

        public Builder recoverySustainCount(int recoverySustainCount) {
            this.recoverySustainCount = recoverySustainCount;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public AnalysisSettings build() {
            return new AnalysisSettings(
                    metricPairs,
                    baselineMinSamples,
                    driftWindowDays,
                    driftMinWindowSamples,
                    correlationMinAlignedDays,
                    rollingWindowDays,
                    deviationMultiplier,
                    moderateMultiplier,
                    severeMultiplier,
                    episodeGapTolerance,
                    driftFraction,
                    recoverySustainCount,
                    zone,
                    workers);
        }
    }
}
