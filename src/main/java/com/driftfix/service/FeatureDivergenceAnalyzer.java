package com.driftfix.service;

import com.driftfix.config.AnalyzerSettings;
import com.driftfix.domain.AnalysisMode;
import com.driftfix.domain.FeatureDivergenceMetric;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.exception.IncompatibleSchemaException;
import com.driftfix.exception.InsufficientDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureDivergenceAnalyzer {

    private static final int KS_SERIES_TERMS = 10;

    private final AnalyzerSettings settings;

    public List<FeatureDivergenceMetric> analyze(FeatureMatrix reference, FeatureMatrix current) {
        return analyze(reference, current, AnalysisMode.STRICT);
    }

    public List<FeatureDivergenceMetric> analyze(FeatureMatrix reference, FeatureMatrix current,
                                                 AnalysisMode mode) {
        validate(reference, current, mode);

        int features = reference.featureCount();
        List<FeatureDivergenceMetric> metrics = new ArrayList<>(features);
        double totalPsi = 0.0;
        for (int i = 0; i < features; i++) {
            FeatureDivergenceMetric metric = analyzeFeature(i, reference.column(i), current.column(i));
            metrics.add(metric);
            totalPsi += metric.getPsiScore();
        }
        if (totalPsi > 0.0) {
            for (int i = 0; i < features; i++) {
                FeatureDivergenceMetric metric = metrics.get(i);
                metrics.set(i, metric.toBuilder().attribution(metric.getPsiScore() / totalPsi).build());
            }
        }
        log.debug("Divergence computed | features={} | refSamples={} | curSamples={} | mode={}",
                  features, reference.sampleCount(), current.sampleCount(), mode);
        return Collections.unmodifiableList(metrics);
    }

    public boolean belowMinimum(FeatureMatrix reference, FeatureMatrix current) {
        return reference.sampleCount() < settings.minSamples() || current.sampleCount() < settings.minSamples();
    }

    /**
     * Population stability index over equal-width bins fixed from the
     * reference range. The outer bins are open-ended so current values outside
     * the reference range are still counted.
     */
    public double psi(double[] reference, double[] current) {
        double[] edges = binEdges(reference);
        double[] refFractions = occupancy(reference, edges);
        double[] curFractions = occupancy(current, edges);
        double psi = 0.0;
        for (int b = 0; b < refFractions.length; b++) {
            double r = refFractions[b];
            double c = curFractions[b];
            psi += (c - r) * Math.log(c / r);
        }
        return Math.max(0.0, psi);
    }

    public double ksStatistic(double[] reference, double[] current) {
        double[] a = reference.clone();
        double[] b = current.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        int n = a.length;
        int m = b.length;
        int i = 0;
        int j = 0;
        double d = 0.0;
        while (i < n && j < m) {
            double x = Math.min(a[i], b[j]);
            while (i < n && a[i] == x) i++;
            while (j < m && b[j] == x) j++;
            d = Math.max(d, Math.abs((double) i / n - (double) j / m));
        }
        return d;
    }

    public double ksPValue(double d, int n, int m) {
        double ne = (double) n * m / (n + m);
        double sqrtNe = Math.sqrt(ne);
        double lambda = (sqrtNe + 0.12 + 0.11 / sqrtNe) * d;
        // the truncated series does not converge for tiny lambda, where Q is 1 anyway
        if (lambda < 0.3) {
            return 1.0;
        }
        double sum = 0.0;
        for (int k = 1; k <= KS_SERIES_TERMS; k++) {
            double term = Math.exp(-2.0 * k * k * lambda * lambda);
            sum += (k % 2 == 1) ? term : -term;
        }
        return clamp(2.0 * sum, 0.0, 1.0);
    }

    private FeatureDivergenceMetric analyzeFeature(int index, double[] reference, double[] current) {
        double eps = settings.epsilon();
        double psi = psi(reference, current);
        double d = ksStatistic(reference, current);
        double pValue = ksPValue(d, reference.length, current.length);

        double refMean = mean(reference);
        double refStd = std(reference, refMean);
        double curMean = mean(current);
        double curStd = std(current, curMean);

        boolean ksDrift = d > settings.ksStatisticThreshold() && pValue < settings.ksPValueThreshold();
        boolean drifted = psi > settings.psiThreshold() || ksDrift;

        double[] refSorted = reference.clone();
        double[] curSorted = current.clone();
        Arrays.sort(refSorted);
        Arrays.sort(curSorted);

        return FeatureDivergenceMetric.builder()
            .featureIndex(index)
            .psiScore(psi)
            .ksStatistic(d)
            .pValue(pValue)
            .meanShift(Math.abs(curMean - refMean) / (refStd + eps))
            .stdShift(Math.abs(curStd - refStd) / (refStd + eps))
            .drifted(drifted)
            .referenceMean(refMean)
            .referenceStd(refStd)
            .currentMean(curMean)
            .currentStd(curStd)
            .minShift(curSorted[0] - refSorted[0])
            .maxShift(curSorted[curSorted.length - 1] - refSorted[refSorted.length - 1])
            .lowerQuartileShift(percentile(curSorted, 25) - percentile(refSorted, 25))
            .medianShift(percentile(curSorted, 50) - percentile(refSorted, 50))
            .upperQuartileShift(percentile(curSorted, 75) - percentile(refSorted, 75))
            .build();
    }

    private void validate(FeatureMatrix reference, FeatureMatrix current, AnalysisMode mode) {
        if (reference.isEmpty() || current.isEmpty()) {
            throw new IncompatibleSchemaException(
                "Reference and current samples must both be non-empty (reference="
                    + reference.sampleCount() + ", current=" + current.sampleCount() + ")");
        }
        if (reference.featureCount() == 0) {
            throw new IncompatibleSchemaException("Samples have no features");
        }
        if (reference.featureCount() != current.featureCount()) {
            throw new IncompatibleSchemaException(
                "Feature count mismatch: reference has " + reference.featureCount()
                    + ", current has " + current.featureCount());
        }
        reference.requireFinite("Reference sample");
        current.requireFinite("Current sample");

        if (mode == AnalysisMode.STRICT) {
            int required = settings.minSamples();
            if (reference.sampleCount() < required) {
                throw new InsufficientDataException("Reference sample", reference.sampleCount(), required);
            }
            if (current.sampleCount() < required) {
                throw new InsufficientDataException("Current sample", current.sampleCount(), required);
            }
        }
    }

    // interior edges only; bin b holds values in [edge[b-1], edge[b])
    private double[] binEdges(double[] reference) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : reference) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max - min <= 0.0) {
            // constant reference: centre a unit window on it
            min -= 0.5;
            max += 0.5;
        }
        int bins = settings.bins();
        double width = (max - min) / bins;
        double[] edges = new double[bins - 1];
        for (int k = 1; k < bins; k++) {
            edges[k - 1] = min + k * width;
        }
        return edges;
    }

    private double[] occupancy(double[] values, double[] edges) {
        int bins = edges.length + 1;
        int[] counts = new int[bins];
        for (double v : values) {
            counts[binIndex(v, edges)]++;
        }
        double[] fractions = new double[bins];
        for (int b = 0; b < bins; b++) {
            fractions[b] = counts[b] == 0 ? settings.epsilon() : (double) counts[b] / values.length;
        }
        return fractions;
    }

    private static int binIndex(double value, double[] edges) {
        int lo = 0;
        int hi = edges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = Math.min(sorted.length - 1, lower + 1);
        double frac = pos - lower;
        return sorted[lower] + frac * (sorted[upper] - sorted[lower]);
    }

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double std(double[] values, double mean) {
        double sq = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sq += diff * diff;
        }
        return Math.sqrt(sq / values.length);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
