package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ModelUpdateParameters(String modelVersion) implements PatchParameters {

    @Override
    @JsonIgnore
    public PatchType type() {
        return PatchType.MODEL_UPDATE;
    }
}
