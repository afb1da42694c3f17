package com.driftfix.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DriftEngineConfig {

    @Value("${drift.analyzer.bins:10}")
    private int bins;

    @Value("${drift.analyzer.epsilon:0.0001}")
    private double epsilon;

    @Value("${drift.analyzer.psi-threshold:0.2}")
    private double psiThreshold;

    @Value("${drift.analyzer.ks-statistic-threshold:0.1}")
    private double ksStatisticThreshold;

    @Value("${drift.analyzer.ks-p-value-threshold:0.05}")
    private double ksPValueThreshold;

    @Value("${drift.analyzer.min-samples:20}")
    private int minSamples;

    @Value("${drift.classifier.detection-threshold:0.2}")
    private double detectionThreshold;

    @Value("${drift.classifier.psi-saturation:1.0}")
    private double psiSaturation;

    @Value("${drift.classifier.prior-ratio-cutoff:0.15}")
    private double priorRatioCutoff;

    @Value("${drift.classifier.concentrated-ratio-cutoff:0.60}")
    private double concentratedRatioCutoff;

    @Value("${drift.classifier.psi-variation-cutoff:0.6}")
    private double psiVariationCutoff;

    @Value("${drift.classifier.shape-to-location-cutoff:1.5}")
    private double shapeToLocationCutoff;

    @Value("${drift.classifier.localized-detection:true}")
    private boolean localizedDetection;

    @Value("${drift.generator.emergency-score-threshold:0.6}")
    private double emergencyScoreThreshold;

    @Value("${drift.generator.threshold-scale:0.1}")
    private double thresholdScale;

    @Value("${drift.generator.max-threshold-delta:0.5}")
    private double maxThresholdDelta;

    @Value("${drift.validator.accept-safety:0.4}")
    private double acceptSafety;

    @Value("${drift.validator.accept-reduction:0.15}")
    private double acceptReduction;

    @Value("${drift.validator.borderline-safety:0.3}")
    private double borderlineSafety;

    @Value("${drift.validator.borderline-reduction:0.10}")
    private double borderlineReduction;

    @Value("${drift.validator.decision-threshold:0.5}")
    private double decisionThreshold;

    @Value("${drift.validator.inference-timeout-ms:5000}")
    private long inferenceTimeoutMs;

    @Value("${drift.validator.split-seed:42}")
    private long splitSeed;

    @Value("${drift.engine.max-patch-log-size:100}")
    private int maxPatchLogSize;

    @Bean
    public AnalyzerSettings analyzerSettings() {
        return new AnalyzerSettings(bins, epsilon, psiThreshold,
                                    ksStatisticThreshold, ksPValueThreshold, minSamples);
    }

    @Bean
    public ClassifierSettings classifierSettings() {
        return new ClassifierSettings(detectionThreshold, psiSaturation, priorRatioCutoff,
                                      concentratedRatioCutoff, psiVariationCutoff,
                                      shapeToLocationCutoff, localizedDetection, psiThreshold);
    }

    @Bean
    public GeneratorSettings generatorSettings() {
        GeneratorSettings d = GeneratorSettings.defaults();
        return new GeneratorSettings(emergencyScoreThreshold,
                                     d.normalizationReduction(), d.clippingReduction(),
                                     d.reweightingReduction(), d.thresholdReduction(),
                                     d.emergencyClippingReduction(),
                                     d.clipLowerPercentile(), d.clipUpperPercentile(),
                                     d.emergencyLowerPercentile(), d.emergencyUpperPercentile(),
                                     thresholdScale, maxThresholdDelta);
    }

    @Bean
    public ValidatorSettings validatorSettings() {
        ValidatorSettings d = ValidatorSettings.defaults();
        return new ValidatorSettings(d.largeDatasetSize(), d.largeSplitFraction(), d.largeSplitMinimum(),
                                     d.smallDatasetSize(), d.smallSplitFraction(), d.smallSplitMinimum(),
                                     d.minValidationSamples(),
                                     acceptSafety, acceptReduction, borderlineSafety, borderlineReduction,
                                     d.accuracyBound(), d.balanceBound(), decisionThreshold,
                                     inferenceTimeoutMs, splitSeed);
    }

    @Bean
    public PatchEngineSettings patchEngineSettings() {
        return new PatchEngineSettings(maxPatchLogSize);
    }
}
