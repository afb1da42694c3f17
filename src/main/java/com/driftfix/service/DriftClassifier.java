package com.driftfix.service;

import com.driftfix.config.ClassifierSettings;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.DriftSeverity;
import com.driftfix.domain.DriftType;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.exception.IncompatibleSchemaException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriftClassifier {

    private static final double EPS = 1e-9;

    private final ClassifierSettings settings;

    public DriftResult classify(List<FeatureDivergenceMetric> metrics) {
        return classify(metrics, null);
    }

    public DriftResult classify(List<FeatureDivergenceMetric> metrics, double[] weights) {
        if (metrics.isEmpty()) {
            throw new IncompatibleSchemaException("Cannot classify drift without feature metrics");
        }
        if (weights != null && weights.length != metrics.size()) {
            throw new IncompatibleSchemaException(
                "Got " + weights.length + " feature weights for " + metrics.size() + " features");
        }

        double overall = overallScore(metrics, weights);
        List<Integer> drifted = new ArrayList<>();
        for (FeatureDivergenceMetric m : metrics) {
            if (m.isDrifted()) {
                drifted.add(m.getFeatureIndex());
            }
        }
        double ratio = (double) drifted.size() / metrics.size();
        DriftType type = classifyType(metrics, ratio);
        boolean detected = overall > settings.detectionThreshold()
            || (settings.localizedDetection() && anyFeatureAboveThreshold(metrics));

        return DriftResult.builder()
            .overallScore(overall)
            .driftDetected(detected)
            .driftType(type)
            .severity(DriftSeverity.fromScore(overall))
            .driftedRatio(ratio)
            .perFeature(List.copyOf(metrics))
            .driftedFeatureIndices(List.copyOf(drifted))
            .build();
    }

    private double overallScore(List<FeatureDivergenceMetric> metrics, double[] weights) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < metrics.size(); i++) {
            double w = weights == null ? 1.0 : Math.max(0.0, weights[i]);
            weighted += w * Math.min(1.0, metrics.get(i).getPsiScore() / settings.psiSaturation());
            totalWeight += w;
        }
        if (totalWeight <= 0.0) {
            return overallScore(metrics, null);
        }
        return weighted / totalWeight;
    }

    private DriftType classifyType(List<FeatureDivergenceMetric> metrics, double ratio) {
        if (ratio < settings.priorRatioCutoff()) {
            return DriftType.PRIOR;
        }
        if (ratio < settings.concentratedRatioCutoff()) {
            List<FeatureDivergenceMetric> drifted = metrics.stream()
                .filter(FeatureDivergenceMetric::isDrifted)
                .toList();
            double cv = psiCoefficientOfVariation(drifted);
            double shapeToLocation = average(drifted, FeatureDivergenceMetric::getStdShift)
                / (average(drifted, FeatureDivergenceMetric::getMeanShift) + EPS);
            log.debug("Concept check | ratio={} | psiCv={} | shapeToLocation={}", ratio, cv, shapeToLocation);
            if (cv > settings.psiVariationCutoff() || shapeToLocation > settings.shapeToLocationCutoff()) {
                return DriftType.CONCEPT;
            }
        }
        return DriftType.COVARIATE;
    }

    private boolean anyFeatureAboveThreshold(List<FeatureDivergenceMetric> metrics) {
        return metrics.stream().anyMatch(m -> m.getPsiScore() > settings.featurePsiThreshold());
    }

    private static double psiCoefficientOfVariation(List<FeatureDivergenceMetric> metrics) {
        double mean = average(metrics, FeatureDivergenceMetric::getPsiScore);
        if (mean < EPS) {
            return 0.0;
        }
        double sq = 0.0;
        for (FeatureDivergenceMetric m : metrics) {
            double diff = m.getPsiScore() - mean;
            sq += diff * diff;
        }
        return Math.sqrt(sq / metrics.size()) / mean;
    }

    private static double average(List<FeatureDivergenceMetric> metrics,
                                  ToDoubleFunction<FeatureDivergenceMetric> field) {
        return metrics.stream().mapToDouble(field).average().orElse(0.0);
    }
}
