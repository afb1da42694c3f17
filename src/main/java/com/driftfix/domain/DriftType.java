package com.driftfix.domain;

public enum DriftType {
    COVARIATE,
    CONCEPT,
    PRIOR
}
