package com.dcruver.themerank.domain;

import java.util.Arrays;

/**
 * Dense vector helpers shared by clustering and ranking.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /**
     * Cosine similarity; 0 when either side has zero norm
     */
    public static double cosine(double[] a, double[] b) {
        double na = norm(a);
        double nb = norm(b);
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot(a, b) / (na * nb);
    }

    public static double cosineDistance(double[] a, double[] b) {
        return 1.0 - cosine(a, b);
    }

    public static double euclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Copy of {@code a} scaled to unit length. Zero vectors are returned unchanged.
     */
    public static double[] normalize(double[] a) {
        double n = norm(a);
        double[] out = a.clone();
        if (n == 0.0) {
            return out;
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= n;
        }
        return out;
    }

    public static double[][] normalizeRows(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = normalize(rows[i]);
        }
        return out;
    }

    public static double[] mean(double[][] rows, int dimension) {
        double[] mean = new double[dimension];
        if (rows.length == 0) {
            return mean;
        }
        for (double[] row : rows) {
            for (int j = 0; j < dimension; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimension; j++) {
            mean[j] /= rows.length;
        }
        return mean;
    }

    /**
     * Unit-length mean of the rows, or the raw mean if it has zero norm
     */
    public static double[] centroid(double[][] rows, int dimension) {
        return normalize(mean(rows, dimension));
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take percentile of empty array");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
