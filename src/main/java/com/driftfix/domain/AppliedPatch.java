package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AppliedPatch {
    String id;
    PatchType type;
    PatchPriority priority;
    PatchParameters parameters;
    String description;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant appliedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant rolledBackAt;
    PatchValidationResult validationResult;
    long ruleSetVersion;

    public static AppliedPatch accepted(PatchCandidate candidate, PatchValidationResult validation) {
        return AppliedPatch.builder()
            .id(candidate.getId())
            .type(candidate.getType())
            .priority(candidate.getPriority())
            .parameters(candidate.getParameters())
            .description(candidate.getDescription())
            .validationResult(validation)
            .build();
    }

    @JsonIgnore
    public boolean isRolledBack() {
        return rolledBackAt != null;
    }
}
