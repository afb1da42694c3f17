package com.driftfix.service;

import com.driftfix.TestData;
import com.driftfix.config.AnalyzerSettings;
import com.driftfix.config.ClassifierSettings;
import com.driftfix.domain.AnalysisMode;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.exception.CorruptDataException;
import com.driftfix.exception.IncompatibleSchemaException;
import com.driftfix.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureDivergenceAnalyzerTest {

    private final FeatureDivergenceAnalyzer analyzer = new FeatureDivergenceAnalyzer(AnalyzerSettings.defaults());

    @Test
    void analyze_identicalSamples_reportsNoDivergence() {
        FeatureMatrix data = TestData.gaussian(500, 10, 7L);

        List<FeatureDivergenceMetric> metrics = analyzer.analyze(data, data);

        assertThat(metrics).hasSize(10);
        assertThat(metrics).allSatisfy(m -> {
            assertThat(m.getPsiScore()).isEqualTo(0.0);
            assertThat(m.getKsStatistic()).isEqualTo(0.0);
            assertThat(m.getPValue()).isEqualTo(1.0);
            assertThat(m.getMeanShift()).isEqualTo(0.0);
            assertThat(m.getAttribution()).isZero();
            assertThat(m.isDrifted()).isFalse();
        });
    }

    @Test
    void analyze_oneShiftedFeature_flagsOnlyThatFeature() {
        FeatureMatrix reference = TestData.gaussian(1000, 20, 1L);
        FeatureMatrix current = TestData.shifted(TestData.gaussian(1000, 20, 2L), 3.0, 0);

        List<FeatureDivergenceMetric> metrics = analyzer.analyze(reference, current);

        FeatureDivergenceMetric shifted = metrics.get(0);
        assertThat(shifted.getPsiScore()).isGreaterThan(1.0);
        assertThat(shifted.getKsStatistic()).isGreaterThan(0.8);
        assertThat(shifted.getPValue()).isLessThan(1e-6);
        assertThat(shifted.getMeanShift()).isBetween(2.7, 3.3);
        assertThat(shifted.isDrifted()).isTrue();
        assertThat(metrics.subList(1, 20)).noneMatch(FeatureDivergenceMetric::isDrifted);
    }

    @Test
    void analyze_attributionSharesAddUpToOne() {
        FeatureMatrix reference = TestData.gaussian(1000, 5, 1L);
        FeatureMatrix current = TestData.shifted(TestData.gaussian(1000, 5, 2L), 2.0, 1, 3);

        List<FeatureDivergenceMetric> metrics = analyzer.analyze(reference, current);

        assertThat(metrics.stream().mapToDouble(FeatureDivergenceMetric::getAttribution).sum())
            .isCloseTo(1.0, within(1e-12));
        assertThat(metrics.get(1).getAttribution() + metrics.get(3).getAttribution()).isGreaterThan(0.9);
        assertThat(metrics.get(1).getAttribution())
            .isCloseTo(metrics.get(1).getPsiScore() / metrics.stream().mapToDouble(FeatureDivergenceMetric::getPsiScore).sum(),
                       within(1e-12));
    }

    @Test
    void analyze_reportsSignedRangeAndQuartileShifts() {
        FeatureMatrix reference = TestData.column(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21);
        FeatureMatrix current = TestData.column(0, 2, 4, 6, 8, 10, 12, 14, 16, 18, 20, 22, 24, 26, 28, 30, 32, 34, 36, 38, 40);

        FeatureDivergenceMetric metric = analyzer.analyze(reference, current).get(0);

        assertThat(metric.getMinShift()).isEqualTo(-1.0);
        assertThat(metric.getMaxShift()).isEqualTo(19.0);
        assertThat(metric.getLowerQuartileShift()).isCloseTo(4.0, within(1e-12));
        assertThat(metric.getMedianShift()).isCloseTo(9.0, within(1e-12));
        assertThat(metric.getUpperQuartileShift()).isCloseTo(14.0, within(1e-12));
    }

    @Test
    void percentile_interpolatesBetweenRanks() {
        double[] sorted = {1.0, 2.0, 3.0, 4.0, 5.0};

        assertThat(FeatureDivergenceAnalyzer.percentile(sorted, 0)).isEqualTo(1.0);
        assertThat(FeatureDivergenceAnalyzer.percentile(sorted, 50)).isEqualTo(3.0);
        assertThat(FeatureDivergenceAnalyzer.percentile(sorted, 100)).isEqualTo(5.0);
        assertThat(FeatureDivergenceAnalyzer.percentile(sorted, 10)).isCloseTo(1.4, within(1e-12));
        assertThat(FeatureDivergenceAnalyzer.percentile(new double[]{7.0}, 95)).isEqualTo(7.0);
    }

    @Test
    void psi_growingMeanShift_neverDecreases() {
        FeatureMatrix reference = TestData.gaussian(1000, 1, 11L);
        double[] ref = reference.column(0);

        double previous = -1.0;
        for (double delta : new double[]{0.0, 0.5, 1.0, 1.5, 2.0, 3.0, 4.0}) {
            double psi = analyzer.psi(ref, TestData.shifted(reference, delta, 0).column(0));
            assertThat(psi).as("psi at shift %s", delta).isGreaterThanOrEqualTo(previous);
            previous = psi;
        }
        assertThat(previous).isGreaterThan(0.2);
    }

    @Test
    void psi_valuesOutsideReferenceRange_landInOuterBins() {
        double[] reference = new double[100];
        for (int i = 0; i < 100; i++) reference[i] = i / 100.0;
        double[] current = new double[100];
        for (int i = 0; i < 100; i++) current[i] = 50.0 + i;

        assertThat(analyzer.psi(reference, current)).isGreaterThan(1.0).isFinite();
    }

    @Test
    void ksStatistic_disjointSamples_isOne() {
        assertThat(analyzer.ksStatistic(new double[]{1, 2, 3, 4}, new double[]{5, 6, 7, 8})).isEqualTo(1.0);
    }

    @Test
    void ksStatistic_tiedValues_stepsTogether() {
        double d = analyzer.ksStatistic(new double[]{1, 1, 2, 2}, new double[]{1, 2, 2, 2});
        assertThat(d).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void ksPValue_decreasesAsStatisticGrows() {
        double small = analyzer.ksPValue(0.02, 500, 500);
        double medium = analyzer.ksPValue(0.08, 500, 500);
        double large = analyzer.ksPValue(0.3, 500, 500);

        assertThat(analyzer.ksPValue(0.0, 500, 500)).isEqualTo(1.0);
        assertThat(small).isGreaterThan(medium);
        assertThat(medium).isGreaterThan(large);
        assertThat(large).isBetween(0.0, 1e-6);
    }

    @Test
    void analyze_computesShiftsAgainstReferenceStd() {
        FeatureMatrix reference = TestData.column(0, 2);
        FeatureMatrix current = TestData.column(2, 4);

        FeatureDivergenceMetric m = analyzer.analyze(reference, current, AnalysisMode.BEST_EFFORT).get(0);

        assertThat(m.getReferenceMean()).isEqualTo(1.0);
        assertThat(m.getReferenceStd()).isEqualTo(1.0);
        assertThat(m.getCurrentMean()).isEqualTo(3.0);
        assertThat(m.getMeanShift()).isCloseTo(2.0 / 1.0001, within(1e-9));
        assertThat(m.getStdShift()).isEqualTo(0.0);
    }

    @Test
    void analyze_featureCountMismatch_throwsIncompatibleSchema() {
        assertThatThrownBy(() -> analyzer.analyze(TestData.gaussian(50, 3, 1L), TestData.gaussian(50, 4, 2L)))
            .isInstanceOf(IncompatibleSchemaException.class)
            .hasMessageContaining("Feature count mismatch");
    }

    @Test
    void analyze_emptyMatrix_throwsIncompatibleSchema() {
        assertThatThrownBy(() -> analyzer.analyze(TestData.gaussian(50, 3, 1L), FeatureMatrix.of(new double[0][])))
            .isInstanceOf(IncompatibleSchemaException.class);
    }

    @Test
    void analyze_nonFiniteValue_throwsCorruptData() {
        double[][] rows = TestData.gaussian(50, 3, 1L).toArray();
        rows[17][2] = Double.NaN;

        assertThatThrownBy(() -> analyzer.analyze(TestData.gaussian(50, 3, 2L), FeatureMatrix.of(rows)))
            .isInstanceOf(CorruptDataException.class)
            .hasMessageContaining("row 17, feature 2");
    }

    @Test
    void analyze_infiniteValue_throwsCorruptData() {
        double[][] rows = TestData.gaussian(50, 3, 1L).toArray();
        rows[0][0] = Double.POSITIVE_INFINITY;

        assertThatThrownBy(() -> analyzer.analyze(FeatureMatrix.of(rows), TestData.gaussian(50, 3, 2L)))
            .isInstanceOf(CorruptDataException.class);
    }

    @Test
    void analyze_tooFewSamples_throwsUnlessBestEffort() {
        FeatureMatrix reference = TestData.gaussian(100, 2, 1L);
        FeatureMatrix small = TestData.gaussian(10, 2, 2L);

        assertThatThrownBy(() -> analyzer.analyze(reference, small))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("10 samples");
        assertThat(analyzer.analyze(reference, small, AnalysisMode.BEST_EFFORT)).hasSize(2);
    }

    @Test
    void analyze_sameInputsTwice_yieldsEqualResults() {
        DriftClassifier classifier = new DriftClassifier(ClassifierSettings.defaults());
        FeatureMatrix reference = TestData.gaussian(300, 6, 3L);
        FeatureMatrix current = TestData.shifted(TestData.gaussian(300, 6, 4L), 1.5, 1, 4);

        DriftResult first = classifier.classify(analyzer.analyze(reference, current));
        DriftResult second = classifier.classify(analyzer.analyze(reference, current));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void analyze_doesNotMutateInputs() {
        FeatureMatrix reference = TestData.gaussian(100, 3, 5L);
        FeatureMatrix current = TestData.gaussian(100, 3, 6L);
        double[][] before = current.toArray();

        analyzer.analyze(reference, current);

        assertThat(current.toArray()).isDeepEqualTo(before);
    }
}
