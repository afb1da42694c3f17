package com.driftfix.service;

import com.driftfix.client.InferenceClient;
import com.driftfix.config.ValidatorSettings;
import com.driftfix.domain.AnalysisMode;
import com.driftfix.domain.ClippingParameters;
import com.driftfix.domain.ClippingParameters.FeatureBound;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.NormalizationParameters;
import com.driftfix.domain.NormalizationParameters.FeatureNormalization;
import com.driftfix.domain.PatchCandidate;
import com.driftfix.domain.PatchParameters;
import com.driftfix.domain.PatchType;
import com.driftfix.domain.PatchValidationResult;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.domain.ReweightingParameters;
import com.driftfix.domain.ReweightingParameters.FeatureWeight;
import com.driftfix.domain.ThresholdParameters;
import com.driftfix.domain.ValidationReport;
import com.driftfix.domain.ValidationSplit;
import com.driftfix.exception.IncompatibleSchemaException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.TreeSet;

/**
 * Re-measures every candidate on a held-out slice of the current data and
 * gates it on drift reduction and a [0, 1] safety score. Rejection is a
 * normal result, never an exception.
 * <p>
 * Safety combines three components: the accuracy delta bounded to ±10%
 * (weight 0.5), how evenly precision and recall move (0.2), and how far the
 * patch parameters move away from reference statistics (0.3).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatchValidator {

    static final String INFERENCE_UNAVAILABLE = "accuracy re-measurement unavailable";

    private static final double ACCURACY_WEIGHT = 0.5;
    private static final double BALANCE_WEIGHT = 0.2;
    private static final double MAGNITUDE_WEIGHT = 0.3;
    private static final double THRESHOLD_SCALE = 0.5;
    private static final double EPS = 1e-9;
    private static final double Z_95 = 1.96;

    private final FeatureDivergenceAnalyzer analyzer;
    private final DriftClassifier classifier;
    private final PatchEngine patchEngine;
    private final ValidatorSettings settings;
    private final Optional<InferenceClient> inferenceClient;

    public ValidationReport validate(String modelId, FeatureMatrix reference, FeatureMatrix current,
                                     List<PatchCandidate> candidates) {
        return validate(modelId, reference, current, candidates, null);
    }

    public ValidationReport validate(String modelId, FeatureMatrix reference, FeatureMatrix current,
                                     List<PatchCandidate> candidates, int[] labels) {
        if (labels != null && labels.length != current.sampleCount()) {
            throw new IncompatibleSchemaException(
                "Got " + labels.length + " labels for " + current.sampleCount() + " samples");
        }
        ValidationSplit split = split(current.sampleCount());
        if (split.fastTrack()) {
            log.warn("Fast-track validation | modelId={} | samples={} | candidates={}",
                     modelId, current.sampleCount(), candidates.size());
        }

        Context ctx = new Context(modelId, reference, current, split, labels);
        List<PatchValidationResult> results = new ArrayList<>(candidates.size());
        for (PatchCandidate candidate : candidates) {
            results.add(split.fastTrack() ? fastTrack(candidate) : measure(ctx, candidate));
        }
        return new ValidationReport(split, results);
    }

    public ValidationSplit split(int n) {
        int size = 0;
        if (n >= settings.largeDatasetSize()) {
            size = Math.max(settings.largeSplitMinimum(), (int) Math.floor(settings.largeSplitFraction() * n));
        } else if (n >= settings.smallDatasetSize()) {
            size = Math.max(settings.smallSplitMinimum(), (int) Math.floor(settings.smallSplitFraction() * n));
        }
        if (size < settings.minValidationSamples() || size >= n) {
            int[] all = new int[n];
            for (int i = 0; i < n; i++) all[i] = i;
            return new ValidationSplit(new int[0], all, true);
        }

        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Random random = new Random(settings.splitSeed());
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        int[] validation = Arrays.copyOfRange(order, 0, size);
        int[] application = Arrays.copyOfRange(order, size, n);
        Arrays.sort(validation);
        Arrays.sort(application);
        return new ValidationSplit(validation, application, false);
    }

    private PatchValidationResult measure(Context ctx, PatchCandidate candidate) {
        return switch (candidate.getType()) {
            case FEATURE_CLIPPING, FEATURE_REWEIGHTING, NORMALIZATION_UPDATE -> measureFeaturePatch(ctx, candidate);
            case THRESHOLD_TUNING -> measureThresholdPatch(ctx, candidate);
            case MODEL_UPDATE -> decide(candidate, 0.0, OutcomeDelta.NEUTRAL,
                                        relativeChange(candidate.getParameters(), ctx.reference), false,
                                        List.of("model updates are not re-measured by preprocessing validation"));
        };
    }

    private PatchValidationResult measureFeaturePatch(Context ctx, PatchCandidate candidate) {
        PreprocessingRuleSet preview = ctx.baseline.compose("preview", candidate.getParameters());
        FeatureMatrix patched = preview.transform(ctx.validation());
        double reduction = reduction(ctx.beforeScore(), driftScore(ctx.reference, patched));

        OutcomeDelta delta = OutcomeDelta.NEUTRAL;
        if (inferenceClient.isPresent()) {
            Optional<FeatureMatrix> before = ctx.validationOutputs();
            Optional<FeatureMatrix> after = predict(ctx.modelId, patched);
            if (before.isEmpty() || after.isEmpty()) {
                return unavailable(candidate, reduction);
            }
            FeatureMatrix beforeAdjusted = ctx.baseline.adjustOutputs(before.get());
            FeatureMatrix afterAdjusted = preview.adjustOutputs(after.get());
            int[] truth = ctx.truth(beforeAdjusted);
            int[] patchedClasses = classes(afterAdjusted);
            delta = compare(truth, classes(beforeAdjusted), patchedClasses);
            return withInterval(decide(candidate, reduction, delta,
                                       relativeChange(candidate.getParameters(), ctx.reference), false, List.of()),
                                truth, patchedClasses);
        }
        return decide(candidate, reduction, delta, relativeChange(candidate.getParameters(), ctx.reference),
                      false, List.of());
    }

    private PatchValidationResult measureThresholdPatch(Context ctx, PatchCandidate candidate) {
        double relChange = relativeChange(candidate.getParameters(), ctx.reference);
        if (inferenceClient.isEmpty()) {
            return decide(candidate, candidate.getExpectedDriftReduction(), OutcomeDelta.NEUTRAL, relChange, true,
                          List.of("no inference runtime: output drift reduction estimated, not measured"));
        }
        Optional<FeatureMatrix> referenceOutputs = ctx.referenceOutputs();
        Optional<FeatureMatrix> outputs = ctx.validationOutputs();
        if (referenceOutputs.isEmpty() || outputs.isEmpty()) {
            return unavailable(candidate, candidate.getExpectedDriftReduction());
        }
        FeatureMatrix current = ctx.baseline.adjustOutputs(outputs.get());
        FeatureMatrix adjusted = ctx.baseline.compose("preview", candidate.getParameters())
            .adjustOutputs(outputs.get());
        double before = outputPsi(referenceOutputs.get(), current);
        double after = outputPsi(referenceOutputs.get(), adjusted);
        int[] truth = ctx.truth(current);
        int[] patchedClasses = classes(adjusted);
        OutcomeDelta delta = compare(truth, classes(current), patchedClasses);
        return withInterval(decide(candidate, reduction(before, after), delta, relChange, false, List.of()),
                            truth, patchedClasses);
    }

    private static PatchValidationResult withInterval(PatchValidationResult result, int[] truth, int[] patched) {
        if (truth.length == 0) {
            return result;
        }
        double[] interval = wilsonInterval(accuracy(truth, patched), truth.length);
        return result.toBuilder()
            .confidenceIntervalLower(interval[0])
            .confidenceIntervalUpper(interval[1])
            .build();
    }

    static double[] wilsonInterval(double p, int n) {
        double z2 = Z_95 * Z_95;
        double denominator = 1.0 + z2 / n;
        double centre = (p + z2 / (2.0 * n)) / denominator;
        double margin = Z_95 * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * n)) / denominator;
        return new double[]{
            FeatureDivergenceAnalyzer.clamp(centre - margin, 0.0, 1.0),
            FeatureDivergenceAnalyzer.clamp(centre + margin, 0.0, 1.0)
        };
    }

    private PatchValidationResult fastTrack(PatchCandidate candidate) {
        double reduction = candidate.getType() == PatchType.MODEL_UPDATE ? 0.0 : candidate.getExpectedDriftReduction();
        double relChange = relativeChangeWithoutReference(candidate.getParameters());
        return decide(candidate, reduction, OutcomeDelta.NEUTRAL, relChange, true,
                      List.of("fast-track validation: too few samples for a held-out split, reduction estimated"));
    }

    private PatchValidationResult decide(PatchCandidate candidate, double reduction, OutcomeDelta delta,
                                         double relChange, boolean approximate, List<String> notes) {
        double safety = safetyScore(delta, relChange);
        boolean full = safety > settings.acceptSafety() && reduction > settings.acceptReduction();
        boolean borderline = !full
            && safety >= settings.borderlineSafety()
            && reduction >= settings.borderlineReduction();

        List<String> warnings = new ArrayList<>(notes);
        String reason = null;
        if (borderline) {
            warnings.add(String.format(Locale.ROOT,
                "accepted in borderline band: safety %.2f, drift reduction %.2f", safety, reduction));
        } else if (!full) {
            reason = rejectionReason(safety, reduction);
        }
        boolean accepted = full || borderline;

        if (accepted && borderline) {
            log.warn("Candidate accepted with warning | id={} | type={} | safety={} | reduction={}",
                     candidate.getId(), candidate.getType(), round(safety), round(reduction));
        } else if (accepted) {
            log.info("Candidate accepted | id={} | type={} | safety={} | reduction={} | approximate={}",
                     candidate.getId(), candidate.getType(), round(safety), round(reduction), approximate);
        } else {
            log.info("Candidate rejected | id={} | type={} | reason={}", candidate.getId(), candidate.getType(), reason);
        }

        return PatchValidationResult.builder()
            .candidateId(candidate.getId())
            .patchType(candidate.getType())
            .safetyScore(safety)
            .accuracyDelta(delta.accuracy())
            .precisionDelta(delta.precision())
            .recallDelta(delta.recall())
            .measuredDriftReduction(reduction)
            .accepted(accepted)
            .borderline(borderline)
            .approximate(approximate)
            .rejectionReason(reason)
            .warnings(List.copyOf(warnings))
            .build();
    }

    private PatchValidationResult unavailable(PatchCandidate candidate, double reduction) {
        log.info("Candidate rejected | id={} | type={} | reason={}",
                 candidate.getId(), candidate.getType(), INFERENCE_UNAVAILABLE);
        return PatchValidationResult.builder()
            .candidateId(candidate.getId())
            .patchType(candidate.getType())
            .safetyScore(0.0)
            .measuredDriftReduction(reduction)
            .accepted(false)
            .rejectionReason(INFERENCE_UNAVAILABLE)
            .warnings(List.of())
            .build();
    }

    private String rejectionReason(double safety, double reduction) {
        List<String> reasons = new ArrayList<>(2);
        if (safety < settings.borderlineSafety()) {
            reasons.add(String.format(Locale.ROOT, "safety score %.2f below threshold %.2f",
                                      safety, settings.borderlineSafety()));
        }
        if (reduction < settings.borderlineReduction()) {
            reasons.add(String.format(Locale.ROOT, "drift reduction %.2f below threshold %.2f",
                                      reduction, settings.borderlineReduction()));
        }
        return String.join("; ", reasons);
    }

    double safetyScore(OutcomeDelta delta, double relChange) {
        double accuracy = FeatureDivergenceAnalyzer.clamp(1.0 + delta.accuracy() / settings.accuracyBound(), 0.0, 1.0);
        double balance = 1.0 - Math.min(1.0, Math.abs(delta.precision() - delta.recall()) / settings.balanceBound());
        double magnitude = 1.0 / (1.0 + Math.max(0.0, relChange));
        return FeatureDivergenceAnalyzer.clamp(
            ACCURACY_WEIGHT * accuracy + BALANCE_WEIGHT * balance + MAGNITUDE_WEIGHT * magnitude, 0.0, 1.0);
    }

    private double relativeChange(PatchParameters parameters, FeatureMatrix reference) {
        if (parameters instanceof ClippingParameters clipping) {
            double total = 0.0;
            for (FeatureBound bound : clipping.bounds()) {
                double[] column = reference.column(bound.featureIndex());
                double min = Arrays.stream(column).min().orElse(0.0);
                double max = Arrays.stream(column).max().orElse(0.0);
                double cut = Math.max(0.0, bound.min() - min) + Math.max(0.0, max - bound.max());
                total += Math.min(1.0, cut / (max - min + EPS));
            }
            return clipping.bounds().isEmpty() ? 0.0 : total / clipping.bounds().size();
        }
        return relativeChangeWithoutReference(parameters);
    }

    // clipping needs the reference range; every other type carries its own baseline
    private double relativeChangeWithoutReference(PatchParameters parameters) {
        return switch (parameters.type()) {
            case NORMALIZATION_UPDATE -> {
                List<FeatureNormalization> features = ((NormalizationParameters) parameters).features();
                double total = 0.0;
                for (FeatureNormalization f : features) {
                    total += Math.abs(f.currentMean() - f.referenceMean()) / (f.referenceStd() + EPS)
                        + Math.abs(Math.log((f.currentStd() + EPS) / (f.referenceStd() + EPS)));
                }
                yield features.isEmpty() ? 0.0 : total / features.size();
            }
            case FEATURE_REWEIGHTING -> {
                List<FeatureWeight> weights = ((ReweightingParameters) parameters).weights();
                yield weights.stream().mapToDouble(w -> Math.abs(w.multiplier() - 1.0)).average().orElse(0.0);
            }
            case THRESHOLD_TUNING -> Math.abs(((ThresholdParameters) parameters).delta()) / THRESHOLD_SCALE;
            // bounds alone do not say how much of the reference range is cut
            case FEATURE_CLIPPING -> 0.0;
            case MODEL_UPDATE -> 1.0;
        };
    }

    private double driftScore(FeatureMatrix reference, FeatureMatrix sample) {
        return classifier.classify(analyzer.analyze(reference, sample, AnalysisMode.BEST_EFFORT)).getOverallScore();
    }

    private double outputPsi(FeatureMatrix referenceOutputs, FeatureMatrix outputs) {
        int columns = Math.min(referenceOutputs.featureCount(), outputs.featureCount());
        double total = 0.0;
        for (int j = 0; j < columns; j++) {
            total += analyzer.psi(referenceOutputs.column(j), outputs.column(j));
        }
        return columns == 0 ? 0.0 : total / columns;
    }

    private static double reduction(double before, double after) {
        if (before <= EPS) {
            return 0.0;
        }
        return (before - after) / before;
    }

    private Optional<FeatureMatrix> predict(String modelId, FeatureMatrix features) {
        InferenceClient client = inferenceClient.orElseThrow();
        try {
            FeatureMatrix outputs = client.predict(modelId, features)
                .block(Duration.ofMillis(settings.inferenceTimeoutMs()));
            if (outputs == null || outputs.sampleCount() != features.sampleCount() || outputs.featureCount() == 0) {
                log.warn("Inference returned unusable output | modelId={} | rows={} | expected={}",
                         modelId, outputs == null ? 0 : outputs.sampleCount(), features.sampleCount());
                return Optional.empty();
            }
            outputs.requireFinite("Model output");
            return Optional.of(outputs);
        } catch (Exception ex) {
            log.warn("Inference unavailable during validation | modelId={} | reason={}",
                     modelId, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    int[] classes(FeatureMatrix outputs) {
        int[] classes = new int[outputs.sampleCount()];
        for (int i = 0; i < classes.length; i++) {
            double[] row = outputs.row(i);
            if (row.length == 1) {
                classes[i] = row[0] > settings.decisionThreshold() ? 1 : 0;
                continue;
            }
            int best = 0;
            for (int j = 1; j < row.length; j++) {
                if (row[j] > row[best]) best = j;
            }
            classes[i] = best;
        }
        return classes;
    }

    static OutcomeDelta compare(int[] truth, int[] before, int[] after) {
        return new OutcomeDelta(
            accuracy(truth, after) - accuracy(truth, before),
            macroPrecision(truth, after) - macroPrecision(truth, before),
            macroRecall(truth, after) - macroRecall(truth, before));
    }

    private static double accuracy(int[] truth, int[] predicted) {
        int hits = 0;
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] == predicted[i]) hits++;
        }
        return truth.length == 0 ? 0.0 : (double) hits / truth.length;
    }

    private static double macroPrecision(int[] truth, int[] predicted) {
        TreeSet<Integer> labels = labels(truth, predicted);
        double total = 0.0;
        for (int c : labels) {
            int tp = 0;
            int fp = 0;
            for (int i = 0; i < truth.length; i++) {
                if (predicted[i] == c) {
                    if (truth[i] == c) tp++; else fp++;
                }
            }
            total += tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        }
        return labels.isEmpty() ? 0.0 : total / labels.size();
    }

    private static double macroRecall(int[] truth, int[] predicted) {
        TreeSet<Integer> labels = labels(truth, predicted);
        double total = 0.0;
        for (int c : labels) {
            int tp = 0;
            int fn = 0;
            for (int i = 0; i < truth.length; i++) {
                if (truth[i] == c) {
                    if (predicted[i] == c) tp++; else fn++;
                }
            }
            total += tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        }
        return labels.isEmpty() ? 0.0 : total / labels.size();
    }

    private static TreeSet<Integer> labels(int[] truth, int[] predicted) {
        TreeSet<Integer> labels = new TreeSet<>();
        for (int v : truth) labels.add(v);
        for (int v : predicted) labels.add(v);
        return labels;
    }

    private static double round(double value) {
        return Math.round(value * 1e4) / 1e4;
    }

    record OutcomeDelta(double accuracy, double precision, double recall) {
        static final OutcomeDelta NEUTRAL = new OutcomeDelta(0.0, 0.0, 0.0);
    }

    private final class Context {
        private final String modelId;
        private final FeatureMatrix reference;
        private final FeatureMatrix current;
        private final ValidationSplit split;
        private final int[] labels;
        private final PreprocessingRuleSet baseline;

        private FeatureMatrix validation;
        private FeatureMatrix validationSeen;
        private Double beforeScore;
        private Optional<FeatureMatrix> validationOutputs;
        private Optional<FeatureMatrix> referenceOutputs;

        private Context(String modelId, FeatureMatrix reference, FeatureMatrix current,
                        ValidationSplit split, int[] labels) {
            this.modelId = modelId;
            this.reference = reference;
            this.current = current;
            this.split = split;
            this.labels = labels;
            this.baseline = patchEngine.activeRuleSet(modelId);
        }

        private FeatureMatrix validation() {
            if (validation == null) {
                validation = current.select(split.validationIndices());
            }
            return validation;
        }

        private FeatureMatrix validationSeen() {
            if (validationSeen == null) {
                validationSeen = baseline.transform(validation());
            }
            return validationSeen;
        }

        private double beforeScore() {
            if (beforeScore == null) {
                beforeScore = driftScore(reference, validationSeen());
            }
            return beforeScore;
        }

        private Optional<FeatureMatrix> validationOutputs() {
            if (validationOutputs == null) {
                validationOutputs = predict(modelId, validationSeen());
            }
            return validationOutputs;
        }

        private Optional<FeatureMatrix> referenceOutputs() {
            if (referenceOutputs == null) {
                referenceOutputs = predict(modelId, reference);
            }
            return referenceOutputs;
        }

        private int[] truth(FeatureMatrix unpatchedOutputs) {
            if (labels == null) {
                return classes(unpatchedOutputs);
            }
            int[] picked = new int[split.validationSize()];
            int[] indices = split.validationIndices();
            for (int i = 0; i < indices.length; i++) {
                picked[i] = labels[indices[i]];
            }
            return picked;
        }
    }
}
