package com.driftfix.config;

public record PatchEngineSettings(int maxPatchLogSize) {
    public static PatchEngineSettings defaults() {
        return new PatchEngineSettings(100);
    }
}
