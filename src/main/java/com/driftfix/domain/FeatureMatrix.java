package com.driftfix.domain;

import com.driftfix.exception.CorruptDataException;
import com.driftfix.exception.IncompatibleSchemaException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

public final class FeatureMatrix {

    private final double[][] rows;
    private final int featureCount;

    private FeatureMatrix(double[][] rows, int featureCount) {
        this.rows = rows;
        this.featureCount = featureCount;
    }

    public static FeatureMatrix of(double[][] rows) {
        if (rows == null || rows.length == 0) {
            return new FeatureMatrix(new double[0][], 0);
        }
        int width = rows[0] == null ? 0 : rows[0].length;
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != width) {
                throw new IncompatibleSchemaException(
                    "Row " + i + " has " + (rows[i] == null ? 0 : rows[i].length)
                        + " features, expected " + width);
            }
            copy[i] = rows[i].clone();
        }
        return new FeatureMatrix(copy, width);
    }

    @JsonCreator
    public static FeatureMatrix fromLists(List<List<Double>> rows) {
        if (rows == null) {
            return of(null);
        }
        double[][] raw = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null) {
                raw[i] = null;
                continue;
            }
            raw[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Double v = row.get(j);
                // JSON null is treated as a missing reading, which is corrupt input
                raw[i][j] = v == null ? Double.NaN : v;
            }
        }
        return of(raw);
    }

    public int sampleCount() {
        return rows.length;
    }

    public int featureCount() {
        return featureCount;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public double get(int row, int feature) {
        return rows[row][feature];
    }

    public double[] row(int index) {
        return rows[index].clone();
    }

    public double[] column(int feature) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][feature];
        }
        return values;
    }

    public FeatureMatrix select(int[] rowIndices) {
        double[][] picked = new double[rowIndices.length][];
        for (int i = 0; i < rowIndices.length; i++) {
            picked[i] = rows[rowIndices[i]].clone();
        }
        return new FeatureMatrix(picked, featureCount);
    }

    public FeatureMatrix mapRows(UnaryOperator<double[]> mapper) {
        double[][] mapped = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] out = mapper.apply(rows[i].clone());
            if (out.length != featureCount) {
                throw new IncompatibleSchemaException(
                    "Row transform changed feature count from " + featureCount + " to " + out.length);
            }
            mapped[i] = out;
        }
        return new FeatureMatrix(mapped, featureCount);
    }

    public void requireFinite(String label) {
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < featureCount; j++) {
                double v = rows[i][j];
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    throw new CorruptDataException(
                        label + " contains a non-finite value (" + v + ") at row " + i + ", feature " + j);
                }
            }
        }
    }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    @JsonValue
    public List<List<Double>> toLists() {
        List<List<Double>> out = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            List<Double> values = new ArrayList<>(row.length);
            for (double v : row) {
                values.add(v);
            }
            out.add(values);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureMatrix other)) {
            return false;
        }
        return featureCount == other.featureCount && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * featureCount + Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "FeatureMatrix[" + rows.length + "x" + featureCount + "]";
    }
}
