package com.driftfix.domain;

public enum PatchType {
    FEATURE_CLIPPING,
    FEATURE_REWEIGHTING,
    NORMALIZATION_UPDATE,
    THRESHOLD_TUNING,
    MODEL_UPDATE
}
