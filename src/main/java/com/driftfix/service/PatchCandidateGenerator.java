package com.driftfix.service;

import com.driftfix.config.GeneratorSettings;
import com.driftfix.domain.ClippingParameters;
import com.driftfix.domain.ClippingParameters.FeatureBound;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.NormalizationParameters;
import com.driftfix.domain.NormalizationParameters.FeatureNormalization;
import com.driftfix.domain.PatchCandidate;
import com.driftfix.domain.PatchPriority;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.domain.ReweightingParameters;
import com.driftfix.domain.ReweightingParameters.FeatureWeight;
import com.driftfix.domain.ThresholdParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
public class PatchCandidateGenerator {

    private static final double MIN_STD = 1e-12;

    private final GeneratorSettings settings;

    public List<PatchCandidate> generate(DriftResult drift, FeatureMatrix current) {
        return generate(drift, current, OptionalDouble.empty());
    }

    public List<PatchCandidate> generate(DriftResult drift, FeatureMatrix current, OptionalDouble outputShift) {
        return generate(drift, current, outputShift, PreprocessingRuleSet.identity());
    }

    /**
     * Generates candidates for a model that already runs {@code active}.
     * {@code drift} must be measured on data passed through {@code active};
     * {@code current} is the raw data, since clipping runs first.
     */
    public List<PatchCandidate> generate(DriftResult drift, FeatureMatrix current, OptionalDouble outputShift,
                                         PreprocessingRuleSet active) {
        if (!drift.isDriftDetected()) {
            return List.of();
        }
        List<Integer> drifted = drift.getDriftedFeatureIndices();
        List<PatchCandidate> candidates = new ArrayList<>();

        switch (drift.getDriftType()) {
            case COVARIATE -> {
                if (!drifted.isEmpty()) {
                    candidates.add(normalization(drift, drifted, active));
                    candidates.add(clipping(current, drifted, PatchPriority.SECONDARY,
                                            settings.clipLowerPercentile(), settings.clipUpperPercentile(),
                                            settings.clippingReduction()));
                }
            }
            case CONCEPT -> {
                if (!drifted.isEmpty()) {
                    candidates.add(reweighting(drift, drifted));
                }
            }
            case PRIOR -> candidates.add(threshold(drift, outputShift));
        }

        if (drift.getOverallScore() > settings.emergencyScoreThreshold()) {
            List<Integer> targets = drifted.isEmpty() ? allFeatures(drift.featureCount()) : drifted;
            candidates.add(clipping(current, targets, PatchPriority.EMERGENCY,
                                    settings.emergencyLowerPercentile(), settings.emergencyUpperPercentile(),
                                    settings.emergencyClippingReduction()));
        }

        log.info("Candidates generated | driftType={} | score={} | drifted={} | candidates={}",
                 drift.getDriftType(), format(drift.getOverallScore()), drifted.size(), candidates.size());
        return Collections.unmodifiableList(candidates);
    }

    private PatchCandidate normalization(DriftResult drift, List<Integer> features, PreprocessingRuleSet active) {
        List<FeatureNormalization> updates = new ArrayList<>(features.size());
        for (int i : features) {
            FeatureDivergenceMetric m = drift.feature(i);
            double currentMean = m.getCurrentMean();
            double currentStd = m.getCurrentStd();
            FeatureNormalization existing = active.getNormalization().get(i);
            if (existing != null && existing.referenceStd() > 0.0) {
                // a new normalization replaces the active one, so map the stats back to its input side
                double slope = existing.currentStd() < MIN_STD ? 1.0 : existing.currentStd() / existing.referenceStd();
                currentMean = existing.currentMean() + (currentMean - existing.referenceMean()) * slope;
                currentStd = currentStd * slope;
            }
            updates.add(new FeatureNormalization(i, m.getReferenceMean(), m.getReferenceStd(),
                                                 currentMean, currentStd));
        }
        return PatchCandidate.of(PatchPriority.PRIMARY, new NormalizationParameters(updates),
                                 settings.normalizationReduction(),
                                 "Re-normalize features " + features + " from current mean/std back to the reference mean/std");
    }

    private PatchCandidate reweighting(DriftResult drift, List<Integer> features) {
        List<FeatureWeight> weights = new ArrayList<>(features.size());
        for (int i : features) {
            weights.add(new FeatureWeight(i, 1.0 / (1.0 + drift.feature(i).getPsiScore())));
        }
        return PatchCandidate.of(PatchPriority.PRIMARY, new ReweightingParameters(weights),
                                 settings.reweightingReduction(),
                                 "Down-weight features " + features + " in proportion to their drift score");
    }

    private PatchCandidate threshold(DriftResult drift, OptionalDouble outputShift) {
        double raw = outputShift.isPresent()
            ? outputShift.getAsDouble()
            : settings.thresholdScale() * drift.getOverallScore();
        double max = settings.maxThresholdDelta();
        double delta = Math.max(-max, Math.min(max, raw));
        return PatchCandidate.of(PatchPriority.PRIMARY, new ThresholdParameters(delta),
                                 settings.thresholdReduction(),
                                 "Shift the output decision threshold by " + format(delta)
                                     + (outputShift.isPresent() ? " to offset the measured output shift"
                                                                : " estimated from the drift score"));
    }

    private PatchCandidate clipping(FeatureMatrix current, List<Integer> features, PatchPriority priority,
                                    double lowerPercentile, double upperPercentile, double expectedReduction) {
        List<FeatureBound> bounds = new ArrayList<>(features.size());
        for (int i : features) {
            double[] sorted = current.column(i);
            Arrays.sort(sorted);
            bounds.add(new FeatureBound(i, FeatureDivergenceAnalyzer.percentile(sorted, lowerPercentile),
                                        FeatureDivergenceAnalyzer.percentile(sorted, upperPercentile)));
        }
        return PatchCandidate.of(priority, new ClippingParameters(bounds), expectedReduction,
                                 String.format(Locale.ROOT, "Clip features %s to the [p%.0f, p%.0f] range of current data",
                                               features, lowerPercentile, upperPercentile));
    }

    private static List<Integer> allFeatures(int count) {
        List<Integer> all = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            all.add(i);
        }
        return all;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
