package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ThresholdParameters(double delta) implements PatchParameters {

    @Override
    @JsonIgnore
    public PatchType type() {
        return PatchType.THRESHOLD_TUNING;
    }
}
