package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftFixResult {
    String modelId;
    DriftResult originalDriftResult;
    List<AppliedPatch> acceptedPatches;
    List<PatchValidationResult> rejectedPatches;
    DriftResult finalDriftResult;
    double reductionPercent;
    boolean approximate;
    Long ruleSetVersion;

    public static double reduction(double originalScore, double finalScore) {
        if (originalScore == 0.0) {
            return 0.0;
        }
        return (originalScore - finalScore) / originalScore;
    }
}
