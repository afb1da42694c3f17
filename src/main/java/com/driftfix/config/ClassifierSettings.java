package com.driftfix.config;

public record ClassifierSettings(
    double detectionThreshold,
    double psiSaturation,
    double priorRatioCutoff,
    double concentratedRatioCutoff,
    double psiVariationCutoff,
    double shapeToLocationCutoff,
    boolean localizedDetection,
    double featurePsiThreshold
) {
    public static ClassifierSettings defaults() {
        return new ClassifierSettings(0.2, 1.0, 0.15, 0.60, 0.6, 1.5, true, 0.2);
    }
}
