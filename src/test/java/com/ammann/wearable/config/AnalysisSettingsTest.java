/* (C)2026 */
package com.ammann.wearable.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.wearable.exception.ConfigurationException;
import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class AnalysisSettingsTest {

    @Test
    void defaultsAreValid() {
        AnalysisSettings settings = AnalysisSettings.defaults().validate();

        assertThat(settings.metricPairs()).hasSize(15);
        assertThat(settings.baselineMinSamples()).isEqualTo(14);
        assertThat(settings.correlationMinAlignedDays()).isEqualTo(10);
        assertThat(settings.rollingWindowDays()).isEqualTo(14);
        assertThat(settings.deviationMultiplier()).isEqualTo(2.5);
        assertThat(settings.episodeGapTolerance()).isEqualTo(Duration.ofDays(2));
        assertThat(settings.recoverySustainCount()).isEqualTo(2);
    }

    static Stream<Arguments> invalidSettings() {
        return Stream.of(
                Arguments.of("metric-pairs", (UnaryOperator<AnalysisSettings.Builder>) b -> b.metricPairs(List.of())),
                Arguments.of("baseline.min-samples", (UnaryOperator<AnalysisSettings.Builder>) b -> b.baselineMinSamples(1)),
                Arguments.of("correlation.min-aligned-days", (UnaryOperator<AnalysisSettings.Builder>) b -> b.correlationMinAlignedDays(2)),
                Arguments.of("correlation.rolling-window-days", (UnaryOperator<AnalysisSettings.Builder>) b -> b.rollingWindowDays(9)),
                Arguments.of("anomaly.deviation-multiplier", (UnaryOperator<AnalysisSettings.Builder>) b -> b.deviationMultiplier(0)),
                Arguments.of("anomaly.moderate-multiplier", (UnaryOperator<AnalysisSettings.Builder>) b -> b.moderateMultiplier(2.5)),
                Arguments.of("anomaly.severe-multiplier", (UnaryOperator<AnalysisSettings.Builder>) b -> b.severeMultiplier(3.0)),
                Arguments.of("anomaly.drift-fraction", (UnaryOperator<AnalysisSettings.Builder>) b -> b.driftFraction(-1)),
                Arguments.of("anomaly.episode-gap-tolerance", (UnaryOperator<AnalysisSettings.Builder>) b -> b.episodeGapTolerance(Duration.ZERO)),
                Arguments.of("recovery.sustain-count", (UnaryOperator<AnalysisSettings.Builder>) b -> b.recoverySustainCount(0)),
                Arguments.of("workers", (UnaryOperator<AnalysisSettings.Builder>) b -> b.workers(0)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidSettings")
    void rejectsInvalidValue(String setting, UnaryOperator<AnalysisSettings.Builder> change) {
        AnalysisSettings settings = change.apply(AnalysisSettings.builder()).build();

        assertThatThrownBy(settings::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(setting);
    }

    @Test
    void toBuilderKeepsOtherValues() {
        AnalysisSettings changed = AnalysisSettings.defaults().toBuilder().workers(8).build();

        assertThat(changed.workers()).isEqualTo(8);
        assertThat(changed.baselineMinSamples()).isEqualTo(AnalysisSettings.DEFAULT_BASELINE_MIN_SAMPLES);
    }
}
