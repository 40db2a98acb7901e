package com.ammann.wearable.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CorrelationTrendTest
{

    @ParameterizedTest
    @CsvSource({
        "0.01, STRENGTHENING",
        "0.0051, STRENGTHENING",
        "0.005, STABLE",
        "0.0, STABLE",
        "-0.005, STABLE",
        "-0.02, WEAKENING"
    })
    void classifiesSlope(double slope, CorrelationTrend expected)
    {
        assertThat(CorrelationTrend.fromSlope(slope)).isEqualTo(expected);
    }

    @Test
    void nanSlopeMeansTooFewWindows()
    {
        assertThat(CorrelationTrend.fromSlope(Double.NaN)).isEqualTo(CorrelationTrend.INSUFFICIENT_DATA);
    }
}
