package com.driftfix.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TransformRequest {

    @NotEmpty(message = "features must contain at least one sample")
    List<List<Double>> features;

    List<List<Double>> outputs;
}
