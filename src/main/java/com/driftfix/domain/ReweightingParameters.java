package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ReweightingParameters(List<FeatureWeight> weights) implements PatchParameters {

    public ReweightingParameters {
        weights = List.copyOf(weights);
    }

    @Override
    @JsonIgnore
    public PatchType type() {
        return PatchType.FEATURE_REWEIGHTING;
    }

    public record FeatureWeight(int featureIndex, double multiplier) {}
}
