package com.example.slides.orchestrator;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ThresholdDescriptionsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "0.05|0.05 (very sensitive)",
        "0.15|0.15 (sensitive)",
        "0.25|0.25 (sensitive)",
        "0.30|0.30 (balanced)",
        "0.45|0.45 (conservative)",
        "1.0|1.00 (conservative)"
    })
    void testSceneThresholdLabels(double value, String expected) {
        assertEquals(expected, ThresholdDescriptions.describeSceneThreshold(value));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "0.5|0.50 (aggressive)",
        "0.80|0.80 (strict)",
        "0.87|0.87 (strict)",
        "0.92|0.92 (balanced)",
        "0.95|0.95 (lenient)",
        "1.0|1.00 (lenient)"
    })
    void testSimilarityThresholdLabels(double value, String expected) {
        assertEquals(expected, ThresholdDescriptions.describeSimilarityThreshold(value));
    }
}
