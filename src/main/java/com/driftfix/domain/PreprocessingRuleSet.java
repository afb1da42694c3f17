package com.driftfix.domain;

import com.driftfix.domain.ClippingParameters.FeatureBound;
import com.driftfix.domain.NormalizationParameters.FeatureNormalization;
import com.driftfix.domain.ReweightingParameters.FeatureWeight;
import com.driftfix.exception.IncompatibleSchemaException;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Materialized preprocessing for one model version. Stages always run in the
 * order clip, reweight, normalize on features and threshold on outputs,
 * whichever patches produced them.
 * <p>
 * Composition rules: clipping bounds intersect (the newer bound wins when the
 * intersection is empty), weights multiply, normalization replaces per feature,
 * threshold deltas add, model version is replaced.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PreprocessingRuleSet {

    private static final double MIN_STD = 1e-12;

    long version;
    Map<Integer, FeatureBound> clipping;
    Map<Integer, Double> weights;
    Map<Integer, FeatureNormalization> normalization;
    double thresholdDelta;
    String modelVersion;
    List<String> patchIds;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;

    public static PreprocessingRuleSet identity() {
        return PreprocessingRuleSet.builder()
            .version(0)
            .clipping(Map.of())
            .weights(Map.of())
            .normalization(Map.of())
            .thresholdDelta(0.0)
            .patchIds(List.of())
            .createdAt(Instant.EPOCH)
            .build();
    }

    @JsonIgnore
    public boolean isIdentity() {
        return clipping.isEmpty() && weights.isEmpty() && normalization.isEmpty()
            && thresholdDelta == 0.0 && modelVersion == null;
    }

    public PreprocessingRuleSet compose(String patchId, PatchParameters parameters) {
        PreprocessingRuleSetBuilder next = toBuilder();
        switch (parameters.type()) {
            case FEATURE_CLIPPING -> next.clipping(mergeClipping((ClippingParameters) parameters));
            case FEATURE_REWEIGHTING -> next.weights(mergeWeights((ReweightingParameters) parameters));
            case NORMALIZATION_UPDATE -> next.normalization(mergeNormalization((NormalizationParameters) parameters));
            case THRESHOLD_TUNING -> next.thresholdDelta(thresholdDelta + ((ThresholdParameters) parameters).delta());
            case MODEL_UPDATE -> next.modelVersion(((ModelUpdateParameters) parameters).modelVersion());
        }
        List<String> ids = new ArrayList<>(patchIds);
        ids.add(patchId);
        return next.patchIds(Collections.unmodifiableList(ids)).build();
    }

    public FeatureMatrix transform(FeatureMatrix input) {
        if (clipping.isEmpty() && weights.isEmpty() && normalization.isEmpty()) {
            return input;
        }
        requireFeatures(input.featureCount());
        return input.mapRows(row -> {
            for (Map.Entry<Integer, FeatureBound> e : clipping.entrySet()) {
                int j = e.getKey();
                row[j] = Math.max(e.getValue().min(), Math.min(e.getValue().max(), row[j]));
            }
            for (Map.Entry<Integer, Double> e : weights.entrySet()) {
                row[e.getKey()] *= e.getValue();
            }
            for (Map.Entry<Integer, FeatureNormalization> e : normalization.entrySet()) {
                FeatureNormalization n = e.getValue();
                double scale = n.currentStd() < MIN_STD ? 1.0 : n.referenceStd() / n.currentStd();
                row[e.getKey()] = (row[e.getKey()] - n.currentMean()) * scale + n.referenceMean();
            }
            return row;
        });
    }

    public FeatureMatrix adjustOutputs(FeatureMatrix outputs) {
        if (thresholdDelta == 0.0) {
            return outputs;
        }
        return outputs.mapRows(row -> {
            for (int j = 0; j < row.length; j++) {
                row[j] -= thresholdDelta;
            }
            return row;
        });
    }

    private void requireFeatures(int featureCount) {
        int highest = -1;
        for (Integer i : clipping.keySet()) highest = Math.max(highest, i);
        for (Integer i : weights.keySet()) highest = Math.max(highest, i);
        for (Integer i : normalization.keySet()) highest = Math.max(highest, i);
        if (highest >= featureCount) {
            throw new IncompatibleSchemaException(
                "Rule set v" + version + " targets feature " + highest
                    + " but the matrix has only " + featureCount + " features");
        }
    }

    private Map<Integer, FeatureBound> mergeClipping(ClippingParameters parameters) {
        Map<Integer, FeatureBound> merged = new TreeMap<>(clipping);
        for (FeatureBound bound : parameters.bounds()) {
            FeatureBound existing = merged.get(bound.featureIndex());
            if (existing == null) {
                merged.put(bound.featureIndex(), bound);
                continue;
            }
            double min = Math.max(existing.min(), bound.min());
            double max = Math.min(existing.max(), bound.max());
            merged.put(bound.featureIndex(), min <= max ? new FeatureBound(bound.featureIndex(), min, max) : bound);
        }
        return Collections.unmodifiableMap(merged);
    }

    private Map<Integer, Double> mergeWeights(ReweightingParameters parameters) {
        Map<Integer, Double> merged = new TreeMap<>(weights);
        for (FeatureWeight weight : parameters.weights()) {
            merged.merge(weight.featureIndex(), weight.multiplier(), (a, b) -> a * b);
        }
        return Collections.unmodifiableMap(merged);
    }

    private Map<Integer, FeatureNormalization> mergeNormalization(NormalizationParameters parameters) {
        Map<Integer, FeatureNormalization> merged = new TreeMap<>(normalization);
        for (FeatureNormalization feature : parameters.features()) {
            merged.put(feature.featureIndex(), feature);
        }
        return Collections.unmodifiableMap(merged);
    }
}
