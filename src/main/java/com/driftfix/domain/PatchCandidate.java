package com.driftfix.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class PatchCandidate {
    String id;
    PatchType type;
    PatchPriority priority;
    PatchParameters parameters;
    double expectedDriftReduction;
    String description;

    public static PatchCandidate of(PatchPriority priority, PatchParameters parameters,
                                    double expectedDriftReduction, String description) {
        return PatchCandidate.builder()
            .id(UUID.randomUUID().toString())
            .type(parameters.type())
            .priority(priority)
            .parameters(parameters)
            .expectedDriftReduction(expectedDriftReduction)
            .description(description)
            .build();
    }
}
