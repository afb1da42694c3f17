package com.driftfix.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DriftResult {
    double overallScore;
    boolean driftDetected;
    DriftType driftType;
    DriftSeverity severity;
    double driftedRatio;
    List<FeatureDivergenceMetric> perFeature;
    // ascending, no duplicates
    List<Integer> driftedFeatureIndices;

    public FeatureDivergenceMetric feature(int index) {
        return perFeature.get(index);
    }

    public int featureCount() {
        return perFeature.size();
    }
}
