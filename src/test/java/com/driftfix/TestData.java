package com.driftfix;

import com.driftfix.domain.FeatureMatrix;

import java.util.Random;

/** Seeded sample matrices for tests. */
public final class TestData {

    private TestData() {
    }

    public static FeatureMatrix gaussian(int samples, int features, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[samples][features];
        for (int i = 0; i < samples; i++) {
            for (int j = 0; j < features; j++) {
                rows[i][j] = random.nextGaussian();
            }
        }
        return FeatureMatrix.of(rows);
    }

    /** Copy of {@code matrix} with {@code delta} added to the given features. */
    public static FeatureMatrix shifted(FeatureMatrix matrix, double delta, int... features) {
        return matrix.mapRows(row -> {
            for (int j : features) {
                row[j] += delta;
            }
            return row;
        });
    }

    public static FeatureMatrix shiftedAll(FeatureMatrix matrix, double delta) {
        int[] all = new int[matrix.featureCount()];
        for (int j = 0; j < all.length; j++) all[j] = j;
        return shifted(matrix, delta, all);
    }

    public static FeatureMatrix column(double... values) {
        double[][] rows = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            rows[i][0] = values[i];
        }
        return FeatureMatrix.of(rows);
    }
}
