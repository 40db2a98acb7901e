package com.ammann.wearable.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeverityTest
{

    @ParameterizedTest
    @CsvSource({
        "2.6, MILD",
        "-2.9, MILD",
        "3.0, MODERATE",
        "-4.99, MODERATE",
        "5.0, SEVERE",
        "-6.0, SEVERE"
    })
    void classifiesByMagnitude(double deviation, Severity expected)
    {
        assertThat(Severity.fromDeviation(deviation, 3.0, 5.0)).isEqualTo(expected);
    }
}
