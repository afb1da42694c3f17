package com.driftfix.service;

import com.driftfix.config.GeneratorSettings;
import com.driftfix.domain.ClippingParameters;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.DriftSeverity;
import com.driftfix.domain.DriftType;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.NormalizationParameters;
import com.driftfix.domain.NormalizationParameters.FeatureNormalization;
import com.driftfix.domain.PatchCandidate;
import com.driftfix.domain.PatchPriority;
import com.driftfix.domain.PatchType;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.domain.ReweightingParameters;
import com.driftfix.domain.ThresholdParameters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.*;

class PatchCandidateGeneratorTest {

    private final PatchCandidateGenerator generator = new PatchCandidateGenerator(GeneratorSettings.defaults());

    /** Two features; column 0 holds 0..99, column 1 holds 100..199. */
    private static FeatureMatrix current() {
        double[][] rows = new double[100][2];
        for (int i = 0; i < 100; i++) {
            rows[i][0] = i;
            rows[i][1] = 100 + i;
        }
        return FeatureMatrix.of(rows);
    }

    private static FeatureDivergenceMetric metric(int index, double psi, boolean drifted) {
        return FeatureDivergenceMetric.builder()
            .featureIndex(index).psiScore(psi).drifted(drifted)
            .referenceMean(10.0).referenceStd(2.0)
            .currentMean(49.5).currentStd(28.9)
            .build();
    }

    private static DriftResult drift(DriftType type, double score, boolean detected, FeatureDivergenceMetric... metrics) {
        List<Integer> drifted = new ArrayList<>();
        for (FeatureDivergenceMetric m : metrics) {
            if (m.isDrifted()) drifted.add(m.getFeatureIndex());
        }
        return DriftResult.builder()
            .overallScore(score)
            .driftDetected(detected)
            .driftType(type)
            .severity(DriftSeverity.fromScore(score))
            .driftedRatio((double) drifted.size() / metrics.length)
            .perFeature(List.of(metrics))
            .driftedFeatureIndices(drifted)
            .build();
    }

    @Test
    void generate_noDriftDetected_returnsNothing() {
        DriftResult result = drift(DriftType.PRIOR, 0.05, false, metric(0, 0.05, false), metric(1, 0.05, false));

        assertThat(generator.generate(result, current())).isEmpty();
    }

    @Test
    void generate_covariateDrift_proposesNormalizationThenClipping() {
        DriftResult result = drift(DriftType.COVARIATE, 0.5, true, metric(0, 0.5, true), metric(1, 0.5, true));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).extracting(PatchCandidate::getType)
            .containsExactly(PatchType.NORMALIZATION_UPDATE, PatchType.FEATURE_CLIPPING);
        assertThat(candidates).extracting(PatchCandidate::getPriority)
            .containsExactly(PatchPriority.PRIMARY, PatchPriority.SECONDARY);
        assertThat(candidates.get(0).getExpectedDriftReduction()).isEqualTo(0.70);
        assertThat(candidates.get(1).getExpectedDriftReduction()).isEqualTo(0.50);

        NormalizationParameters normalization = (NormalizationParameters) candidates.get(0).getParameters();
        assertThat(normalization.features()).hasSize(2);
        assertThat(normalization.features().get(0).referenceMean()).isEqualTo(10.0);
        assertThat(normalization.features().get(0).currentStd()).isEqualTo(28.9);

        ClippingParameters clipping = (ClippingParameters) candidates.get(1).getParameters();
        assertThat(clipping.bounds().get(0).min()).isCloseTo(0.99, within(1e-9));
        assertThat(clipping.bounds().get(0).max()).isCloseTo(98.01, within(1e-9));
        assertThat(clipping.bounds().get(1).min()).isCloseTo(100.99, within(1e-9));
    }

    @Test
    void generate_activeNormalization_expressesNewStatsOnItsInputSide() {
        DriftResult result = drift(DriftType.COVARIATE, 0.5, true, metric(0, 0.5, true), metric(1, 0.5, true));
        PreprocessingRuleSet active = PreprocessingRuleSet.identity()
            .compose("earlier", new NormalizationParameters(List.of(new FeatureNormalization(0, 10.0, 2.0, 30.0, 4.0))));

        List<PatchCandidate> candidates = generator.generate(result, current(), OptionalDouble.empty(), active);

        NormalizationParameters normalization = (NormalizationParameters) candidates.get(0).getParameters();
        FeatureNormalization chained = normalization.features().get(0);
        assertThat(chained.currentMean()).isCloseTo(109.0, within(1e-9));
        assertThat(chained.currentStd()).isCloseTo(57.8, within(1e-9));
        assertThat(normalization.features().get(1).currentMean()).isEqualTo(49.5);

        // replacing the active normalization maps raw inputs exactly where stacking would have
        PreprocessingRuleSet replaced = active.compose("next", normalization);
        FeatureMatrix raw = FeatureMatrix.of(new double[][]{{150.0, 120.0}});
        double seen = active.transform(raw).get(0, 0);
        assertThat(replaced.transform(raw).get(0, 0)).isCloseTo((seen - 49.5) * 2.0 / 28.9 + 10.0, within(1e-9));
    }

    @Test
    void generate_candidatesHaveDistinctIdsAndDescriptions() {
        DriftResult result = drift(DriftType.COVARIATE, 0.5, true, metric(0, 0.5, true), metric(1, 0.5, true));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).extracting(PatchCandidate::getId).doesNotHaveDuplicates().doesNotContainNull();
        assertThat(candidates).allSatisfy(c -> assertThat(c.getDescription()).isNotBlank());
    }

    @Test
    void generate_conceptDrift_downWeightsDriftedFeatures() {
        DriftResult result = drift(DriftType.CONCEPT, 0.4, true, metric(0, 1.0, true), metric(1, 0.01, false));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getType()).isEqualTo(PatchType.FEATURE_REWEIGHTING);
        ReweightingParameters weights = (ReweightingParameters) candidates.get(0).getParameters();
        assertThat(weights.weights()).singleElement().satisfies(w -> {
            assertThat(w.featureIndex()).isZero();
            assertThat(w.multiplier()).isCloseTo(0.5, within(1e-12));
        });
    }

    @Test
    void generate_priorDrift_scalesThresholdFromScore() {
        DriftResult result = drift(DriftType.PRIOR, 0.3, true, metric(0, 4.0, true), metric(1, 0.01, false));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(PatchType.THRESHOLD_TUNING);
            assertThat(c.getExpectedDriftReduction()).isEqualTo(0.35);
            assertThat(((ThresholdParameters) c.getParameters()).delta()).isCloseTo(0.03, within(1e-12));
        });
    }

    @Test
    void generate_priorDriftWithMeasuredShift_clampsDelta() {
        DriftResult result = drift(DriftType.PRIOR, 0.3, true, metric(0, 4.0, true), metric(1, 0.01, false));

        PatchCandidate up = generator.generate(result, current(), OptionalDouble.of(0.8)).get(0);
        PatchCandidate down = generator.generate(result, current(), OptionalDouble.of(-0.2)).get(0);

        assertThat(((ThresholdParameters) up.getParameters()).delta()).isEqualTo(0.5);
        assertThat(((ThresholdParameters) down.getParameters()).delta()).isEqualTo(-0.2);
    }

    @Test
    void generate_severeDrift_addsEmergencyClipping() {
        DriftResult result = drift(DriftType.COVARIATE, 0.8, true, metric(0, 2.0, true), metric(1, 0.01, false));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).extracting(PatchCandidate::getPriority)
            .containsExactly(PatchPriority.PRIMARY, PatchPriority.SECONDARY, PatchPriority.EMERGENCY);
        PatchCandidate emergency = candidates.get(2);
        assertThat(emergency.getExpectedDriftReduction()).isEqualTo(0.45);
        ClippingParameters clipping = (ClippingParameters) emergency.getParameters();
        assertThat(clipping.bounds()).singleElement().satisfies(b -> {
            assertThat(b.featureIndex()).isZero();
            assertThat(b.min()).isCloseTo(4.95, within(1e-9));
            assertThat(b.max()).isCloseTo(94.05, within(1e-9));
        });
    }

    @Test
    void generate_severeDriftWithoutDriftedFeatures_clipsEveryFeature() {
        DriftResult result = drift(DriftType.PRIOR, 0.7, true, metric(0, 0.7, false), metric(1, 0.7, false));

        List<PatchCandidate> candidates = generator.generate(result, current());

        assertThat(candidates).extracting(PatchCandidate::getType)
            .containsExactly(PatchType.THRESHOLD_TUNING, PatchType.FEATURE_CLIPPING);
        assertThat(((ClippingParameters) candidates.get(1).getParameters()).bounds()).hasSize(2);
    }
}
