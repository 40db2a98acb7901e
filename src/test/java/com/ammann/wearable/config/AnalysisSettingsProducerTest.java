/* (C)2026 */
package com.ammann.wearable.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.wearable.enumeration.MetricType;
import com.ammann.wearable.exception.ConfigurationException;
import com.ammann.wearable.model.MetricPair;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnalysisSettingsProducerTest {

    @Test
    void usesDefaultPairsWhenNoneConfigured() {
        AnalysisSettingsProducer producer = new AnalysisSettingsProducer();

        AnalysisSettings settings = producer.analysisSettings();

        assertThat(settings.metricPairs()).isEqualTo(MetricPair.defaultPairs());
        assertThat(settings.zone()).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    void parsesAndDeduplicatesConfiguredPairs() {
        AnalysisSettingsProducer producer = new AnalysisSettingsProducer();
        producer.metricPairs = Optional.of(List.of("HR:STEPS", "steps:hr", "BP_DIASTOLIC:SLEEP"));

        assertThat(producer.parsePairs())
                .containsExactly(
                        MetricPair.of(MetricType.HR, MetricType.STEPS),
                        MetricPair.of(MetricType.BP_DIASTOLIC, MetricType.SLEEP));
    }

    @Test
    void unknownMetricInPairListFailsStartup() {
        AnalysisSettingsProducer producer = new AnalysisSettingsProducer();
        producer.metricPairs = Optional.of(List.of("HR:GLUCOSE"));

        assertThatThrownBy(producer::analysisSettings)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("metric-pairs");
    }

    @Test
    void invalidZoneFailsStartup() {
        AnalysisSettingsProducer producer = new AnalysisSettingsProducer();
        producer.zone = "Mars/Olympus";

        assertThatThrownBy(producer::analysisSettings).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidThresholdFailsStartup() {
        AnalysisSettingsProducer producer = new AnalysisSettingsProducer();
        producer.severeMultiplier = 2.0;

        assertThatThrownBy(producer::analysisSettings)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("anomaly.severe-multiplier");
    }
}
