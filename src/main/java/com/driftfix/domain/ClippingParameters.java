package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ClippingParameters(List<FeatureBound> bounds) implements PatchParameters {

    public ClippingParameters {
        bounds = List.copyOf(bounds);
    }

    @Override
    @JsonIgnore
    public PatchType type() {
        return PatchType.FEATURE_CLIPPING;
    }

    public record FeatureBound(int featureIndex, double min, double max) {}
}
