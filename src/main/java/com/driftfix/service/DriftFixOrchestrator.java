package com.driftfix.service;

import com.driftfix.client.ModelMetadataProvider;
import com.driftfix.domain.AnalysisMode;
import com.driftfix.domain.AppliedPatch;
import com.driftfix.domain.DriftFixResult;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.FixOptions;
import com.driftfix.domain.FixStage;
import com.driftfix.domain.PatchCandidate;
import com.driftfix.domain.PatchValidationResult;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.domain.ValidationReport;
import com.driftfix.exception.IncompatibleSchemaException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriftFixOrchestrator {

    private final FeatureDivergenceAnalyzer analyzer;
    private final DriftClassifier classifier;
    private final PatchCandidateGenerator generator;
    private final PatchValidator validator;
    private final PatchEngine patchEngine;
    private final Optional<ModelMetadataProvider> metadataProvider;

    public DriftResult analyze(String modelId, FeatureMatrix reference, FeatureMatrix current,
                               double[] featureWeights) {
        return analyze(modelId, reference, current, featureWeights, AnalysisMode.STRICT);
    }

    public DriftResult analyze(String modelId, FeatureMatrix reference, FeatureMatrix current,
                               double[] featureWeights, AnalysisMode mode) {
        checkModelCompatibility(modelId, reference);
        DriftResult result = classifier.classify(analyzer.analyze(reference, current, mode), featureWeights);
        log.info("Drift analysed | modelId={} | score={} | detected={} | type={} | drifted={} | mode={}",
                 modelId, result.getOverallScore(), result.isDriftDetected(), result.getDriftType(),
                 result.getDriftedFeatureIndices().size(), mode);
        return result;
    }

    public DriftFixResult fix(String modelId, FeatureMatrix reference, FeatureMatrix current) {
        return fix(modelId, reference, current, FixOptions.none());
    }

    public DriftFixResult fix(String modelId, FeatureMatrix reference, FeatureMatrix current, FixOptions options) {
        return fix(modelId, reference, current, options, stage -> { });
    }

    /**
     * Drift is measured on {@code current} as the model sees it, through its
     * active rule set, so a model whose preprocessing already compensates
     * reports no drift and nothing is stacked on top.
     */
    public DriftFixResult fix(String modelId, FeatureMatrix reference, FeatureMatrix current, FixOptions options,
                              Consumer<FixStage> progress) {
        progress.accept(FixStage.ANALYZING);
        checkModelCompatibility(modelId, reference);
        boolean smallSample = options.mode() == AnalysisMode.BEST_EFFORT && analyzer.belowMinimum(reference, current);
        PreprocessingRuleSet before = patchEngine.activeRuleSet(modelId);
        DriftResult original = analyzeSeen(modelId, reference, current, before, options);
        if (!original.isDriftDetected()) {
            return DriftFixResult.builder()
                .modelId(modelId)
                .originalDriftResult(original)
                .acceptedPatches(List.of())
                .rejectedPatches(List.of())
                .finalDriftResult(original)
                .reductionPercent(0.0)
                .approximate(smallSample)
                .build();
        }

        progress.accept(FixStage.VALIDATING);
        List<PatchCandidate> candidates = generator.generate(original, current, options.outputShift(), before);
        ValidationReport report = validator.validate(modelId, reference, current, candidates, options.labels());

        List<AppliedPatch> toApply = new ArrayList<>();
        List<PatchValidationResult> rejected = new ArrayList<>();
        boolean approximate = smallSample;
        for (int i = 0; i < candidates.size(); i++) {
            PatchValidationResult validation = report.results().get(i);
            if (validation.isAccepted()) {
                toApply.add(AppliedPatch.accepted(candidates.get(i), validation));
                approximate |= validation.isApproximate();
            } else {
                rejected.add(validation);
            }
        }

        if (toApply.isEmpty()) {
            log.info("No candidate passed validation | modelId={} | candidates={}", modelId, candidates.size());
            return DriftFixResult.builder()
                .modelId(modelId)
                .originalDriftResult(original)
                .acceptedPatches(List.of())
                .rejectedPatches(List.copyOf(rejected))
                .finalDriftResult(original)
                .reductionPercent(0.0)
                .approximate(smallSample)
                .build();
        }

        progress.accept(FixStage.APPLYING);
        PreprocessingRuleSet active = patchEngine.apply(modelId, toApply);
        List<AppliedPatch> applied = patchEngine.patchLog(modelId).stream()
            .filter(p -> p.getRuleSetVersion() == active.getVersion())
            .toList();

        // re-measure on rows the validator never looked at
        progress.accept(FixStage.REMEASURING);
        FeatureMatrix untouched = current.select(report.split().applicationIndices());
        FeatureMatrix patched = patchEngine.transform(modelId, untouched);
        DriftResult finalResult = classifier.classify(
            analyzer.analyze(reference, patched, AnalysisMode.BEST_EFFORT), options.featureWeights());
        double reduction = DriftFixResult.reduction(original.getOverallScore(), finalResult.getOverallScore());

        log.info("Drift fix finished | modelId={} | version={} | accepted={} | rejected={} | before={} | after={} | reduction={}",
                 modelId, active.getVersion(), applied.size(), rejected.size(),
                 original.getOverallScore(), finalResult.getOverallScore(), reduction);

        return DriftFixResult.builder()
            .modelId(modelId)
            .originalDriftResult(original)
            .acceptedPatches(applied)
            .rejectedPatches(List.copyOf(rejected))
            .finalDriftResult(finalResult)
            .reductionPercent(reduction)
            .approximate(approximate)
            .ruleSetVersion(active.getVersion())
            .build();
    }

    private DriftResult analyzeSeen(String modelId, FeatureMatrix reference, FeatureMatrix current,
                                    PreprocessingRuleSet active, FixOptions options) {
        // schema and data checks run on the raw input before any rule set touches it
        List<FeatureDivergenceMetric> metrics = analyzer.analyze(reference, current, options.mode());
        FeatureMatrix seen = active.transform(current);
        if (seen != current) {
            metrics = analyzer.analyze(reference, seen, options.mode());
        }
        DriftResult result = classifier.classify(metrics, options.featureWeights());
        log.info("Drift analysed | modelId={} | ruleSetVersion={} | score={} | detected={} | type={} | drifted={} | mode={}",
                 modelId, active.getVersion(), result.getOverallScore(), result.isDriftDetected(),
                 result.getDriftType(), result.getDriftedFeatureIndices().size(), options.mode());
        return result;
    }

    private void checkModelCompatibility(String modelId, FeatureMatrix sample) {
        if (metadataProvider.isEmpty()) {
            return;
        }
        OptionalInt expected = metadataProvider.get().expectedFeatureCount(modelId);
        if (expected.isPresent() && expected.getAsInt() != sample.featureCount()) {
            throw new IncompatibleSchemaException(
                "Model '" + modelId + "' expects " + expected.getAsInt()
                    + " features, data has " + sample.featureCount());
        }
    }
}
