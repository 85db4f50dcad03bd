package com.dcruver.themerank.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable fixed-length embedding. The backing array is never exposed.
 */
public final class EmbeddingVector {

    private final float[] values;

    private EmbeddingVector(float[] values) {
        this.values = values;
    }

    public static EmbeddingVector of(float[] values) {
        if (values == null) {
            throw new IllegalArgumentException("Embedding values must not be null");
        }
        return new EmbeddingVector(values.clone());
    }

    public static EmbeddingVector of(double[] values) {
        float[] converted = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = (float) values[i];
        }
        return new EmbeddingVector(converted);
    }

    public static EmbeddingVector of(List<? extends Number> values) {
        float[] converted = new float[values.size()];
        for (int i = 0; i < converted.length; i++) {
            converted[i] = values.get(i).floatValue();
        }
        return new EmbeddingVector(converted);
    }

    public int dimension() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public float get(int index) {
        return values[index];
    }

    public float[] toArray() {
        return values.clone();
    }

    public double[] toDoubleArray() {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }

    public double norm() {
        double sum = 0.0;
        for (float v : values) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine similarity; 0 when either vector has zero norm
     */
    public double cosineSimilarity(EmbeddingVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Embeddings must have same dimension");
        }
        double dot = 0.0;
        for (int i = 0; i < values.length; i++) {
            dot += (double) values[i] * other.values[i];
        }
        double denom = norm() * other.norm();
        return denom == 0.0 ? 0.0 : dot / denom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector)) return false;
        return Arrays.equals(values, ((EmbeddingVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dim=" + values.length + "]";
    }
}
