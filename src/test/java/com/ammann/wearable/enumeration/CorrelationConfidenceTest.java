package com.ammann.wearable.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CorrelationConfidenceTest
{

    @ParameterizedTest
    @CsvSource({
        "30, 0.5, STRONG",
        "30, -0.8, STRONG",
        "29, 0.9, MODERATE",
        "14, 0.3, MODERATE",
        "13, 0.45, WEAK",
        "100, 0.2, WEAK",
        "100, -0.19, NOT_CONFIDENT"
    })
    void labelsBySampleAndEffectSize(int n, double r, CorrelationConfidence expected)
    {
        assertThat(CorrelationConfidence.of(n, r)).isEqualTo(expected);
    }
}
