package com.driftfix.domain;

public enum DriftSeverity {
    MINIMAL, LOW, MODERATE, HIGH, CRITICAL;

    public static DriftSeverity fromScore(double overallScore) {
        if (overallScore >= 0.4) return CRITICAL;
        if (overallScore >= 0.3) return HIGH;
        if (overallScore >= 0.2) return MODERATE;
        if (overallScore >= 0.1) return LOW;
        return MINIMAL;
    }
}
