package com.driftfix.domain;

public enum FixStage {
    ANALYZING(10, "Measuring drift through the active rule set"),
    VALIDATING(35, "Validating patch candidates"),
    APPLYING(70, "Applying accepted patches"),
    REMEASURING(85, "Re-measuring drift on held-out rows");

    private final int progressPercent;
    private final String message;

    FixStage(int progressPercent, String message) {
        this.progressPercent = progressPercent;
        this.message = message;
    }

    public int progressPercent() {
        return progressPercent;
    }

    public String message() {
        return message;
    }
}
