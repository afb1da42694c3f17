package com.driftfix.domain;

public enum PatchPriority {
    PRIMARY,
    SECONDARY,
    EMERGENCY
}
