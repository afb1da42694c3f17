package com.driftfix.dto;

import com.driftfix.domain.AnalysisMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DriftFixRequest {

    @NotEmpty(message = "reference must contain at least one sample")
    List<List<Double>> reference;

    @NotEmpty(message = "current must contain at least one sample")
    List<List<Double>> current;

    List<Double> featureWeights;

    List<Integer> labels;

    @DecimalMin(value = "-1.0", message = "outputShift must be between -1 and 1")
    @DecimalMax(value = "1.0", message = "outputShift must be between -1 and 1")
    Double outputShift;

    AnalysisMode mode;
}
