/* (C)2026 */
package com.ammann.wearable.config;

import com.ammann.wearable.exception.ConfigurationException;
import com.ammann.wearable.model.MetricPair;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer turning {@code wearable.analysis.*} properties into one validated
 * {@link AnalysisSettings} instance.
 *
 * <p>The producer is eager ({@link Startup}) so that a ConfigurationException aborts
 * application startup instead of surfacing in the middle of a run.
 */
@ApplicationScoped
public class AnalysisSettingsProducer {

    private static final Logger LOG = Logger.getLogger(AnalysisSettingsProducer.class);

    /** Comma-separated {@code METRIC:METRIC} list; the default pair list when absent. */
    @ConfigProperty(name = "wearable.analysis.metric-pairs")
    Optional<List<String>> metricPairs = Optional.empty();

    @ConfigProperty(name = "wearable.analysis.baseline.min-samples", defaultValue = "14")
    int baselineMinSamples = AnalysisSettings.DEFAULT_BASELINE_MIN_SAMPLES;

    @ConfigProperty(name = "wearable.analysis.baseline.drift-window-days", defaultValue = "14")
    int driftWindowDays = AnalysisSettings.DEFAULT_DRIFT_WINDOW_DAYS;

    @ConfigProperty(name = "wearable.analysis.baseline.drift-min-window-samples", defaultValue = "3")
    int driftMinWindowSamples = AnalysisSettings.DEFAULT_DRIFT_MIN_WINDOW_SAMPLES;

    @ConfigProperty(name = "wearable.analysis.correlation.min-aligned-days", defaultValue = "10")
    int correlationMinAlignedDays = AnalysisSettings.DEFAULT_CORRELATION_MIN_ALIGNED_DAYS;

    @ConfigProperty(name = "wearable.analysis.correlation.rolling-window-days", defaultValue = "14")
    int rollingWindowDays = AnalysisSettings.DEFAULT_ROLLING_WINDOW_DAYS;

    @ConfigProperty(name = "wearable.analysis.anomaly.deviation-multiplier", defaultValue = "2.5")
    double deviationMultiplier = AnalysisSettings.DEFAULT_DEVIATION_MULTIPLIER;

    @ConfigProperty(name = "wearable.analysis.anomaly.moderate-multiplier", defaultValue = "3.0")
    double moderateMultiplier = AnalysisSettings.DEFAULT_MODERATE_MULTIPLIER;

    @ConfigProperty(name = "wearable.analysis.anomaly.severe-multiplier", defaultValue = "5.0")
    double severeMultiplier = AnalysisSettings.DEFAULT_SEVERE_MULTIPLIER;

    @ConfigProperty(name = "wearable.analysis.anomaly.episode-gap-tolerance", defaultValue = "P2D")
    Duration episodeGapTolerance = AnalysisSettings.DEFAULT_EPISODE_GAP_TOLERANCE;

    @ConfigProperty(name = "wearable.analysis.anomaly.drift-fraction", defaultValue = "0.5")
    double driftFraction = AnalysisSettings.DEFAULT_DRIFT_FRACTION;

    @ConfigProperty(name = "wearable.analysis.recovery.sustain-count", defaultValue = "2")
    int recoverySustainCount = AnalysisSettings.DEFAULT_RECOVERY_SUSTAIN_COUNT;

    @ConfigProperty(name = "wearable.analysis.zone", defaultValue = "UTC")
    String zone = "UTC";

    @ConfigProperty(name = "wearable.analysis.workers", defaultValue = "4")
    int workers = AnalysisSettings.DEFAULT_WORKERS;

    /**
     * Produces the validated settings.
     *
     * @throws ConfigurationException if any value is invalid
     */
    @Produces
    @Singleton
    @Startup
    public AnalysisSettings analysisSettings() {
        AnalysisSettings settings =
                AnalysisSettings.builder()
                        .metricPairs(parsePairs())
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
                        .zone(parseZone())
                        .workers(workers)
                        .build()
                        .validate();

        LOG.infof(
                "Analysis settings loaded: pairs=%d baselineMin=%d correlationMin=%d rolling=%dd"
                        + " multiplier=%.2f severity=%.2f/%.2f sustain=%d workers=%d zone=%s",
                settings.metricPairs().size(),
                settings.baselineMinSamples(),
                settings.correlationMinAlignedDays(),
                settings.rollingWindowDays(),
                settings.deviationMultiplier(),
                settings.moderateMultiplier(),
                settings.severeMultiplier(),
                settings.recoverySustainCount(),
                settings.workers(),
                settings.zone());

        return settings;
    }

    List<MetricPair> parsePairs() {
        if (metricPairs.isEmpty() || metricPairs.get().isEmpty()) {
            return MetricPair.defaultPairs();
        }
        List<MetricPair> pairs = new ArrayList<>();
        for (String entry : metricPairs.get()) {
            try {
                MetricPair pair = MetricPair.parse(entry);
                if (!pairs.contains(pair)) {
                    pairs.add(pair);
                }
            } catch (IllegalArgumentException e) {
                throw ConfigurationException.invalidSetting(
                        "metric-pairs", entry, "METRIC:METRIC with known metric names");
            }
        }
        return pairs;
    }

    ZoneId parseZone() {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw ConfigurationException.invalidSetting("zone", zone, "a valid time zone id");
        }
    }
}
