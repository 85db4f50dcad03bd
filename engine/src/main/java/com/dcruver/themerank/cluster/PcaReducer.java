package com.dcruver.themerank.cluster;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Principal component projection via a thin SVD of the centered data.
 * Component signs are fixed so the largest loading of each axis is positive,
 * which keeps the output stable across runs.
 */
public class PcaReducer implements DimensionReducer {

    private static final double IDENTICAL_TOLERANCE = 1e-9;

    private final int components;

    public PcaReducer(int components) {
        if (components < 1) {
            throw new IllegalArgumentException("PCA needs at least one component");
        }
        this.components = components;
    }

    @Override
    public double[][] reduce(double[][] rows) {
        int n = rows.length;
        int d = rows[0].length;
        int k = Math.min(components, Math.min(n, d));

        double[] mean = new double[d];
        for (double[] row : rows) {
            for (int j = 0; j < d; j++) {
                mean[j] += row[j] / n;
            }
        }

        DMatrixRMaj centered = new DMatrixRMaj(n, d);
        double spread = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                double value = rows[i][j] - mean[j];
                centered.set(i, j, value);
                spread = Math.max(spread, Math.abs(value));
            }
        }

        // identical rows (up to rounding): every projection is zero
        if (spread < IDENTICAL_TOLERANCE) {
            return new double[n][components];
        }

        SingularValueDecomposition_F64<DMatrixRMaj> svd =
            new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(true, true, true));
        if (!svd.decompose(centered)) {
            throw new ArithmeticException("SVD did not converge");
        }

        DMatrixRMaj vt = svd.getV(null, true);
        double[] singular = svd.getSingularValues();
        Integer[] order = new Integer[svd.numberOfSingularValues()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> -singular[i]).thenComparingInt(i -> i));

        double[][] projected = new double[n][components];
        for (int c = 0; c < k && c < order.length; c++) {
            int axis = order[c];
            double sign = loadingSign(vt, axis, d);
            for (int i = 0; i < n; i++) {
                double sum = 0.0;
                for (int j = 0; j < d; j++) {
                    sum += centered.get(i, j) * vt.get(axis, j);
                }
                projected[i][c] = sign * sum;
            }
        }
        return projected;
    }

    @Override
    public String name() {
        return "pca";
    }

    @Override
    public int components() {
        return components;
    }

    private static double loadingSign(DMatrixRMaj vt, int axis, int d) {
        double largest = 0.0;
        for (int j = 0; j < d; j++) {
            double v = vt.get(axis, j);
            if (Math.abs(v) > Math.abs(largest)) {
                largest = v;
            }
        }
        return largest < 0 ? -1.0 : 1.0;
    }
}
