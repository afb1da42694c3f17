package com.driftfix.config;

public record GeneratorSettings(
    double emergencyScoreThreshold,
    double normalizationReduction,
    double clippingReduction,
    double reweightingReduction,
    double thresholdReduction,
    double emergencyClippingReduction,
    double clipLowerPercentile,
    double clipUpperPercentile,
    double emergencyLowerPercentile,
    double emergencyUpperPercentile,
    double thresholdScale,
    double maxThresholdDelta
) {
    public static GeneratorSettings defaults() {
        return new GeneratorSettings(0.6, 0.70, 0.50, 0.60, 0.35, 0.45,
                                     1, 99, 5, 95, 0.1, 0.5);
    }
}
