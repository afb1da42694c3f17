package com.driftfix.domain;

import java.util.OptionalDouble;

public record FixOptions(double[] featureWeights, int[] labels, OptionalDouble outputShift, AnalysisMode mode) {

    public FixOptions {
        outputShift = outputShift == null ? OptionalDouble.empty() : outputShift;
        mode = mode == null ? AnalysisMode.STRICT : mode;
    }

    public static FixOptions none() {
        return new FixOptions(null, null, OptionalDouble.empty(), AnalysisMode.STRICT);
    }
}
