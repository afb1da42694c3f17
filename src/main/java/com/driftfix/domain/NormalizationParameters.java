package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record NormalizationParameters(List<FeatureNormalization> features) implements PatchParameters {

    public NormalizationParameters {
        features = List.copyOf(features);
    }

    @Override
    @JsonIgnore
    public PatchType type() {
        return PatchType.NORMALIZATION_UPDATE;
    }

    public record FeatureNormalization(int featureIndex,
                                       double referenceMean, double referenceStd,
                                       double currentMean, double currentStd) {}
}
