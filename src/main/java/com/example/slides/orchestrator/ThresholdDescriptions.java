package com.example.slides.orchestrator;

import java.util.Locale;

/**
 * Labels shown next to the two tuning values.
 */
public final class ThresholdDescriptions {

    private ThresholdDescriptions() {
    }

    public static String describeSceneThreshold(double value) {
        String label;
        if (value < 0.15) {
            label = "very sensitive";
        } else if (value < 0.30) {
            label = "sensitive";
        } else if (value < 0.45) {
            label = "balanced";
        } else {
            label = "conservative";
        }
        return format(value, label);
    }

    public static String describeSimilarityThreshold(double value) {
        String label;
        if (value < 0.80) {
            label = "aggressive";
        } else if (value < 0.88) {
            label = "strict";
        } else if (value < 0.95) {
            label = "balanced";
        } else {
            label = "lenient";
        }
        return format(value, label);
    }

    private static String format(double value, String label) {
        return String.format(Locale.ROOT, "%.2f (%s)", value, label);
    }
}
