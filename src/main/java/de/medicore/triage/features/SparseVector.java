package de.medicore.triage.features;

import java.util.Arrays;

/**
 * Immutable sparse vector: strictly increasing feature indices with their weights.
 */
public final class SparseVector {

    private final int dimension;
    private final int[] indices;
    private final double[] values;

    public SparseVector(int dimension, int[] indices, double[] values) {
        if (indices.length != values.length) {
            throw new IllegalArgumentException("indices and values differ in length");
        }
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= dimension || (i > 0 && indices[i] <= indices[i - 1])) {
                throw new IllegalArgumentException("indices must be increasing and below " + dimension);
            }
        }
        this.dimension = dimension;
        this.indices = indices.clone();
        this.values = values.clone();
    }

    public static SparseVector zero(int dimension) {
        return new SparseVector(dimension, new int[0], new double[0]);
    }

    public int dimension() {
        return dimension;
    }

    /** Number of stored (non-zero) entries. */
    public int size() {
        return indices.length;
    }

    public int indexAt(int i) {
        return indices[i];
    }

    public double valueAt(int i) {
        return values[i];
    }

    public boolean isZero() {
        return indices.length == 0;
    }

    public double get(int index) {
        int pos = Arrays.binarySearch(indices, index);
        return pos >= 0 ? values[pos] : 0.0;
    }

    public double norm() {
        double sum = 0.0;
        for (double v : values) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
