package com.driftfix.config;

public record AnalyzerSettings(
    int bins,
    double epsilon,
    double psiThreshold,
    double ksStatisticThreshold,
    double ksPValueThreshold,
    int minSamples
) {
    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(10, 1e-4, 0.2, 0.1, 0.05, 20);
    }
}
