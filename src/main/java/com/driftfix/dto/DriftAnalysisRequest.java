package com.driftfix.dto;

import com.driftfix.domain.AnalysisMode;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DriftAnalysisRequest {

    @NotEmpty(message = "reference must contain at least one sample")
    List<List<Double>> reference;

    @NotEmpty(message = "current must contain at least one sample")
    List<List<Double>> current;

    List<Double> featureWeights;

    AnalysisMode mode;
}
