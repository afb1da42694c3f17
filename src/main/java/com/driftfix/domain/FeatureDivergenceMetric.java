package com.driftfix.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FeatureDivergenceMetric {
    int featureIndex;
    double psiScore;
    double ksStatistic;
    @JsonProperty("pValue")
    double pValue;
    double meanShift;
    double stdShift;
    boolean drifted;
    double attribution;
    double referenceMean;
    double referenceStd;
    double currentMean;
    double currentStd;
    // signed, in feature units: current minus reference
    double minShift;
    double maxShift;
    double lowerQuartileShift;
    double medianShift;
    double upperQuartileShift;
}
