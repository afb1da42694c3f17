package com.driftfix.config;

public record ValidatorSettings(
    int largeDatasetSize,
    double largeSplitFraction,
    int largeSplitMinimum,
    int smallDatasetSize,
    double smallSplitFraction,
    int smallSplitMinimum,
    int minValidationSamples,
    double acceptSafety,
    double acceptReduction,
    double borderlineSafety,
    double borderlineReduction,
    double accuracyBound,
    double balanceBound,
    double decisionThreshold,
    long inferenceTimeoutMs,
    long splitSeed
) {
    public static ValidatorSettings defaults() {
        return new ValidatorSettings(100, 0.20, 20, 50, 0.10, 10, 20,
                                     0.4, 0.15, 0.3, 0.10, 0.10, 0.3, 0.5,
                                     5_000, 42L);
    }
}
