package com.driftfix.domain;

import java.util.Arrays;

/**
 * Row indices of the held-out validation subset and of the subset a patch is
 * finally applied to. The two never share an index. On the fast track the
 * validation subset is empty and the application subset is every row.
 */
public record ValidationSplit(int[] validationIndices, int[] applicationIndices, boolean fastTrack) {

    public ValidationSplit {
        validationIndices = validationIndices.clone();
        applicationIndices = applicationIndices.clone();
    }

    @Override
    public int[] validationIndices() {
        return validationIndices.clone();
    }

    @Override
    public int[] applicationIndices() {
        return applicationIndices.clone();
    }

    public int validationSize() {
        return validationIndices.length;
    }

    public int applicationSize() {
        return applicationIndices.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationSplit other)) return false;
        return fastTrack == other.fastTrack
            && Arrays.equals(validationIndices, other.validationIndices)
            && Arrays.equals(applicationIndices, other.applicationIndices);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(validationIndices) + Arrays.hashCode(applicationIndices))
            + Boolean.hashCode(fastTrack);
    }

    @Override
    public String toString() {
        return "ValidationSplit[validation=" + validationIndices.length
            + ", application=" + applicationIndices.length + ", fastTrack=" + fastTrack + "]";
    }
}
