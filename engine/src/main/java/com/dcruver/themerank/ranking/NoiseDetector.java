package com.dcruver.themerank.ranking;

import com.dcruver.themerank.config.RankingProperties;
import com.dcruver.themerank.domain.VectorMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Outlier detection over cosine distance: a DBSCAN re-pass whose radius comes
 * from the k-distance heuristic, and a local outlier factor score used when
 * the re-pass cannot run.
 */
@Component
@RequiredArgsConstructor
public class NoiseDetector {

    private static final double MIN_EPS = 1e-6;
    private static final double MAX_EPS = 0.9999;
    private static final double LRD_EPSILON = 1e-10;

    private final RankingProperties properties;

    /**
     * Percentile of every point's distance to its k-th nearest neighbour,
     * clamped into (0, 1). Falls back to the default radius when there are
     * no more than k points.
     */
    public double estimateEps(double[][] rows, int k) {
        int n = rows.length;
        if (k < 1 || n <= k) {
            return properties.getDefaultEps();
        }

        double[][] distances = cosineDistances(rows);
        double[] kth = new double[n];
        for (int i = 0; i < n; i++) {
            kth[i] = sortedNeighbourDistances(distances, i)[k - 1];
        }

        double eps = VectorMath.percentile(kth, properties.getEpsPercentile());
        if (!Double.isFinite(eps)) {
            throw new ArithmeticException("Non-finite eps estimate");
        }
        return Math.max(MIN_EPS, Math.min(MAX_EPS, eps));
    }

    /**
     * Points DBSCAN would label as noise: not core and not within {@code eps}
     * of a core point. A point is core when at least {@code dbscanMinSamples}
     * points, itself included, lie within {@code eps}.
     */
    public boolean[] dbscanOutliers(double[][] rows, double eps) {
        int n = rows.length;
        double[][] distances = cosineDistances(rows);

        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            int reachable = 0;
            for (int j = 0; j < n; j++) {
                if (Double.isNaN(distances[i][j])) {
                    throw new ArithmeticException("Non-finite distance between points " + i + " and " + j);
                }
                if (distances[i][j] <= eps) {
                    reachable++;
                }
            }
            core[i] = reachable >= properties.getDbscanMinSamples();
        }

        boolean[] outliers = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (core[i]) {
                continue;
            }
            boolean border = false;
            for (int j = 0; j < n && !border; j++) {
                border = j != i && core[j] && distances[i][j] <= eps;
            }
            outliers[i] = !border;
        }
        return outliers;
    }

    /**
     * Local outlier factor mapped to a 0-10 cleanliness (10 = most inlying).
     * Returns 5 for every point when the scores do not vary.
     */
    public double[] lofCleanliness(double[][] rows) {
        int n = rows.length;
        double[] cleanliness = new double[n];
        if (n < 2) {
            Arrays.fill(cleanliness, 5.0);
            return cleanliness;
        }

        int k = Math.min(Math.max(2, properties.getLofNeighbors()), n - 1);
        double[][] distances = cosineDistances(rows);

        int[][] neighbours = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            neighbours[i] = nearest(distances, i, k);
            kDistance[i] = distances[i][neighbours[i][k - 1]];
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0.0;
            for (int o : neighbours[i]) {
                reach += Math.max(kDistance[o], distances[i][o]);
            }
            lrd[i] = 1.0 / (reach / k + LRD_EPSILON);
        }

        double[] negativeFactor = new double[n];
        for (int i = 0; i < n; i++) {
            double ratio = 0.0;
            for (int o : neighbours[i]) {
                ratio += lrd[o];
            }
            negativeFactor[i] = -(ratio / k) / lrd[i];
        }

        double min = Arrays.stream(negativeFactor).min().orElse(0.0);
        double max = Arrays.stream(negativeFactor).max().orElse(0.0);
        for (int i = 0; i < n; i++) {
            cleanliness[i] = Math.abs(max - min) < 1e-12
                ? 5.0
                : VectorMath.clamp((negativeFactor[i] - min) / (max - min) * 10.0, 0.0, 10.0);
        }
        return cleanliness;
    }

    /**
     * Flag the points whose cleanliness falls below the given percentile of the slice
     */
    public boolean[] belowPercentile(double[] cleanliness, double percentile) {
        boolean[] flags = new boolean[cleanliness.length];
        if (cleanliness.length == 0) {
            return flags;
        }
        double threshold = VectorMath.percentile(cleanliness, percentile);
        for (int i = 0; i < cleanliness.length; i++) {
            flags[i] = cleanliness[i] < threshold;
        }
        return flags;
    }

    private static double[][] cosineDistances(double[][] rows) {
        int n = rows.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = Math.max(0.0, VectorMath.cosineDistance(rows[i], rows[j]));
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return distances;
    }

    private static double[] sortedNeighbourDistances(double[][] distances, int i) {
        int n = distances.length;
        double[] others = new double[n - 1];
        int m = 0;
        for (int j = 0; j < n; j++) {
            if (j != i) {
                others[m++] = distances[i][j];
            }
        }
        Arrays.sort(others);
        return others;
    }

    private static int[] nearest(double[][] distances, int i, int k) {
        Integer[] order = new Integer[distances.length];
        for (int j = 0; j < order.length; j++) {
            order[j] = j;
        }
        Arrays.sort(order, Comparator
            .comparingInt((Integer j) -> j == i ? 0 : 1)
            .thenComparingDouble(j -> distances[i][j])
            .thenComparingInt(j -> j));
        int[] result = new int[k];
        for (int m = 0; m < k; m++) {
            result[m] = order[m + 1];
        }
        return result;
    }
}
