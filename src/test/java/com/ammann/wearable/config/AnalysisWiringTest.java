/* (C)2026 */
package com.ammann.wearable.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.wearable.service.CohortAnalysisService;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AnalysisWiringTest {

    @Inject AnalysisSettings settings;

    @Inject CohortAnalysisService analysisService;

    @Test
    void settingsComeFromApplicationProperties() {
        assertThat(settings.workers()).isEqualTo(2);
        assertThat(settings.metricPairs()).hasSize(15);
        assertThat(settings.baselineMinSamples()).isEqualTo(AnalysisSettings.DEFAULT_BASELINE_MIN_SAMPLES);
    }

    @Test
    void cohortServiceIsIdleAtStartup() {
        assertThat(analysisService.isRunning()).isFalse();
    }
}
