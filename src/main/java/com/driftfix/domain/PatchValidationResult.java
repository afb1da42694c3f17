package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchValidationResult {
    String candidateId;
    PatchType patchType;
    double safetyScore;
    double accuracyDelta;
    double precisionDelta;
    double recallDelta;
    Double confidenceIntervalLower;
    Double confidenceIntervalUpper;
    double measuredDriftReduction;
    boolean accepted;
    boolean borderline;
    boolean approximate;
    String rejectionReason;
    List<String> warnings;
}
