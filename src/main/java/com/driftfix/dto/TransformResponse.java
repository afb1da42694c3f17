package com.driftfix.dto;

import com.driftfix.domain.FeatureMatrix;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransformResponse {
    String modelId;
    long ruleSetVersion;
    FeatureMatrix features;
    FeatureMatrix outputs;
}
