package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClippingParameters.class, name = "FEATURE_CLIPPING"),
    @JsonSubTypes.Type(value = ReweightingParameters.class, name = "FEATURE_REWEIGHTING"),
    @JsonSubTypes.Type(value = NormalizationParameters.class, name = "NORMALIZATION_UPDATE"),
    @JsonSubTypes.Type(value = ThresholdParameters.class, name = "THRESHOLD_TUNING"),
    @JsonSubTypes.Type(value = ModelUpdateParameters.class, name = "MODEL_UPDATE")
})
public sealed interface PatchParameters
        permits ClippingParameters, ReweightingParameters, NormalizationParameters,
                ThresholdParameters, ModelUpdateParameters {

    @JsonIgnore
    PatchType type();
}
