package com.driftfix.domain;

public enum AnalysisMode {
    STRICT,
    BEST_EFFORT
}
