package com.driftfix.service;

import com.driftfix.config.ClassifierSettings;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.DriftSeverity;
import com.driftfix.domain.DriftType;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.exception.IncompatibleSchemaException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DriftClassifierTest {

    private final DriftClassifier classifier = new DriftClassifier(ClassifierSettings.defaults());

    private static FeatureDivergenceMetric metric(int index, double psi, boolean drifted,
                                                  double meanShift, double stdShift) {
        return FeatureDivergenceMetric.builder()
            .featureIndex(index).psiScore(psi).drifted(drifted)
            .meanShift(meanShift).stdShift(stdShift)
            .ksStatistic(drifted ? 0.5 : 0.02).pValue(drifted ? 0.0 : 0.9)
            .build();
    }

    private static List<FeatureDivergenceMetric> stable(int from, int to) {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        for (int i = from; i < to; i++) {
            metrics.add(metric(i, 0.01, false, 0.02, 0.01));
        }
        return metrics;
    }

    @Test
    void classify_noDriftedFeatures_notDetected() {
        DriftResult result = classifier.classify(stable(0, 10));

        assertThat(result.isDriftDetected()).isFalse();
        assertThat(result.getOverallScore()).isCloseTo(0.01, within(1e-12));
        assertThat(result.getDriftedFeatureIndices()).isEmpty();
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.MINIMAL);
    }

    @Test
    void classify_oneOfTwentyFeaturesDrifted_isPriorAndDetectedLocally() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        metrics.add(metric(0, 4.0, true, 3.0, 0.05));
        metrics.addAll(stable(1, 20));

        DriftResult result = classifier.classify(metrics);

        assertThat(result.getDriftType()).isEqualTo(DriftType.PRIOR);
        assertThat(result.getDriftedRatio()).isCloseTo(0.05, within(1e-12));
        assertThat(result.getDriftedFeatureIndices()).containsExactly(0);
        assertThat(result.getOverallScore()).isLessThan(0.2);
        assertThat(result.isDriftDetected()).isTrue();
    }

    @Test
    void classify_localizedDetectionOff_usesOverallScoreOnly() {
        ClassifierSettings d = ClassifierSettings.defaults();
        DriftClassifier strict = new DriftClassifier(new ClassifierSettings(
            d.detectionThreshold(), d.psiSaturation(), d.priorRatioCutoff(), d.concentratedRatioCutoff(),
            d.psiVariationCutoff(), d.shapeToLocationCutoff(), false, d.featurePsiThreshold()));
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        metrics.add(metric(0, 4.0, true, 3.0, 0.05));
        metrics.addAll(stable(1, 20));

        assertThat(strict.classify(metrics).isDriftDetected()).isFalse();
    }

    @Test
    void classify_allFeaturesShiftedConsistently_isCovariate() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            metrics.add(metric(i, 0.5, true, 1.0, 0.1));
        }

        DriftResult result = classifier.classify(metrics);

        assertThat(result.getDriftType()).isEqualTo(DriftType.COVARIATE);
        assertThat(result.getOverallScore()).isCloseTo(0.5, within(1e-12));
        assertThat(result.isDriftDetected()).isTrue();
        assertThat(result.getSeverity()).isEqualTo(DriftSeverity.CRITICAL);
    }

    @Test
    void classify_partialDriftWithInconsistentPsi_isConcept() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        metrics.add(metric(0, 0.3, true, 1.0, 0.1));
        metrics.add(metric(1, 1.5, true, 1.0, 0.1));
        metrics.add(metric(2, 3.0, true, 1.0, 0.1));
        metrics.addAll(stable(3, 10));

        assertThat(classifier.classify(metrics).getDriftType()).isEqualTo(DriftType.CONCEPT);
    }

    @Test
    void classify_partialDriftDominatedByShapeChange_isConcept() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            metrics.add(metric(i, 0.5, true, 1.0, 2.0));
        }
        metrics.addAll(stable(3, 10));

        assertThat(classifier.classify(metrics).getDriftType()).isEqualTo(DriftType.CONCEPT);
    }

    @Test
    void classify_partialDriftWithConsistentLocationShift_fallsThroughToCovariate() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            metrics.add(metric(i, 0.5, true, 1.0, 0.2));
        }
        metrics.addAll(stable(3, 10));

        assertThat(classifier.classify(metrics).getDriftType()).isEqualTo(DriftType.COVARIATE);
    }

    @Test
    void classify_majorityDrifted_isCovariateEvenWhenInconsistent() {
        List<FeatureDivergenceMetric> metrics = new ArrayList<>();
        double[] psi = {0.3, 3.0, 0.4, 2.5, 0.25, 4.0, 0.3};
        for (int i = 0; i < psi.length; i++) {
            metrics.add(metric(i, psi[i], true, 0.5, 2.0));
        }
        metrics.addAll(stable(7, 10));

        assertThat(classifier.classify(metrics).getDriftType()).isEqualTo(DriftType.COVARIATE);
    }

    @Test
    void classify_psiAboveSaturation_contributesOne() {
        DriftResult result = classifier.classify(List.of(metric(0, 5.0, true, 3.0, 0.0), metric(1, 0.0, false, 0, 0)));

        assertThat(result.getOverallScore()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void classify_featureWeights_weightOverallScore() {
        List<FeatureDivergenceMetric> metrics = List.of(metric(0, 1.0, true, 2.0, 0.0), metric(1, 0.0, false, 0, 0));

        assertThat(classifier.classify(metrics, new double[]{3, 1}).getOverallScore()).isCloseTo(0.75, within(1e-12));
        assertThat(classifier.classify(metrics, new double[]{0, 0}).getOverallScore()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void classify_weightCountMismatch_throwsIncompatibleSchema() {
        assertThatThrownBy(() -> classifier.classify(stable(0, 3), new double[]{1, 1}))
            .isInstanceOf(IncompatibleSchemaException.class);
    }

    @Test
    void severity_followsScoreBands() {
        assertThat(DriftSeverity.fromScore(0.05)).isEqualTo(DriftSeverity.MINIMAL);
        assertThat(DriftSeverity.fromScore(0.1)).isEqualTo(DriftSeverity.LOW);
        assertThat(DriftSeverity.fromScore(0.25)).isEqualTo(DriftSeverity.MODERATE);
        assertThat(DriftSeverity.fromScore(0.35)).isEqualTo(DriftSeverity.HIGH);
        assertThat(DriftSeverity.fromScore(0.4)).isEqualTo(DriftSeverity.CRITICAL);
    }
}
