package com.dcruver.themerank.cluster;

import com.dcruver.themerank.domain.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Uniform manifold approximation and projection over cosine distance.
 *
 * Builds the fuzzy k-nearest-neighbour graph (smooth kNN distances with a
 * binary-searched bandwidth per point, then fuzzy union), initializes the
 * layout with PCA and optimizes it with negative-sampling SGD. A single seeded
 * {@link Random} drives every stochastic step so equal inputs give equal
 * layouts.
 */
@Slf4j
public class UmapReducer implements DimensionReducer {

    private static final int NEGATIVE_SAMPLE_RATE = 5;
    private static final double SMOOTH_K_TOLERANCE = 1e-5;
    private static final double MIN_K_DIST_SCALE = 1e-3;
    private static final int BANDWIDTH_ITERATIONS = 64;
    private static final double GRADIENT_CLIP = 4.0;
    private static final double INIT_SPREAD = 10.0;

    private final int neighbors;
    private final int components;
    private final double minDist;
    private final int epochs;
    private final long seed;

    private final double a;
    private final double b;

    public UmapReducer(int neighbors, int components, double minDist, int epochs, long seed) {
        if (neighbors < 1 || components < 1) {
            throw new IllegalArgumentException("UMAP needs at least one neighbour and one component");
        }
        this.neighbors = neighbors;
        this.components = components;
        this.minDist = minDist;
        this.epochs = epochs;
        this.seed = seed;
        double[] ab = fitCurve(1.0, minDist);
        this.a = ab[0];
        this.b = ab[1];
    }

    @Override
    public double[][] reduce(double[][] rows) {
        int n = rows.length;
        int k = Math.min(neighbors, n - 1);
        Random random = new Random(seed);

        int[][] knnIndices = new int[n][k];
        double[][] knnDistances = new double[n][k];
        nearestNeighbours(rows, k, knnIndices, knnDistances);

        List<Edge> graph = fuzzySimplicialSet(n, k, knnIndices, knnDistances);
        double[][] embedding = initialLayout(rows, random);

        int nEpochs = epochs > 0 ? epochs : (n <= 10_000 ? 500 : 200);
        optimizeLayout(embedding, graph, nEpochs, random);

        log.debug("UMAP reduced {} rows to {} components ({} neighbours, {} edges, {} epochs)",
            n, components, k, graph.size(), nEpochs);
        return embedding;
    }

    @Override
    public String name() {
        return "umap";
    }

    @Override
    public int components() {
        return components;
    }

    public int neighbors() {
        return neighbors;
    }

    double curveA() {
        return a;
    }

    double curveB() {
        return b;
    }

    private static void nearestNeighbours(double[][] rows, int k, int[][] indices, double[][] distances) {
        int n = rows.length;
        double[][] unit = VectorMath.normalizeRows(rows);
        for (int i = 0; i < n; i++) {
            final int self = i;
            double[] dist = new double[n];
            Integer[] order = new Integer[n];
            for (int j = 0; j < n; j++) {
                order[j] = j;
                dist[j] = Math.max(0.0, 1.0 - VectorMath.dot(unit[i], unit[j]));
            }
            Arrays.sort(order, Comparator
                .comparingInt((Integer j) -> j == self ? 0 : 1)
                .thenComparingDouble(j -> dist[j])
                .thenComparingInt(j -> j));
            for (int m = 0; m < k; m++) {
                indices[i][m] = order[m + 1];
                distances[i][m] = dist[order[m + 1]];
            }
        }
    }

    /**
     * Per-point membership strengths, symmetrized with the fuzzy union
     * {@code w + w' - w * w'}.
     */
    private static List<Edge> fuzzySimplicialSet(int n, int k, int[][] indices, double[][] distances) {
        double target = Math.log(k) / Math.log(2);
        double meanDistance = Arrays.stream(distances).flatMapToDouble(Arrays::stream).average().orElse(0.0);

        List<Map<Integer, Double>> directed = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double rho = 0.0;
            for (double d : distances[i]) {
                if (d > 0.0) {
                    rho = d;
                    break;
                }
            }

            double lo = 0.0;
            double hi = Double.POSITIVE_INFINITY;
            double sigma = 1.0;
            for (int iter = 0; iter < BANDWIDTH_ITERATIONS; iter++) {
                double sum = 0.0;
                for (double d : distances[i]) {
                    double gap = d - rho;
                    sum += gap > 0 ? Math.exp(-gap / sigma) : 1.0;
                }
                if (Math.abs(sum - target) < SMOOTH_K_TOLERANCE) {
                    break;
                }
                if (sum > target) {
                    hi = sigma;
                    sigma = (lo + hi) / 2.0;
                } else {
                    lo = sigma;
                    sigma = Double.isInfinite(hi) ? sigma * 2 : (lo + hi) / 2.0;
                }
            }

            double rowMean = Arrays.stream(distances[i]).average().orElse(0.0);
            double floor = MIN_K_DIST_SCALE * (rho > 0.0 ? rowMean : meanDistance);
            sigma = Math.max(sigma, floor);

            Map<Integer, Double> weights = new HashMap<>();
            for (int m = 0; m < k; m++) {
                double gap = distances[i][m] - rho;
                double w = (gap <= 0.0 || sigma == 0.0) ? 1.0 : Math.exp(-gap / sigma);
                weights.put(indices[i][m], w);
            }
            directed.add(weights);
        }

        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (Map.Entry<Integer, Double> entry : directed.get(i).entrySet()) {
                int j = entry.getKey();
                double w = entry.getValue();
                double reverse = directed.get(j).getOrDefault(i, 0.0);
                if (reverse > 0.0 && j < i) {
                    continue;
                }
                double union = w + reverse - w * reverse;
                if (union > 0.0) {
                    edges.add(new Edge(i, j, union));
                }
            }
        }
        edges.sort(Comparator.comparingInt(Edge::head).thenComparingInt(Edge::tail));
        return edges;
    }

    /**
     * PCA layout rescaled into [0, 10] with a little seeded jitter, so points
     * with identical inputs do not start on top of each other.
     */
    private double[][] initialLayout(double[][] rows, Random random) {
        int n = rows.length;
        double[][] layout = new PcaReducer(components).reduce(rows);

        for (int c = 0; c < components; c++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] point : layout) {
                min = Math.min(min, point[c]);
                max = Math.max(max, point[c]);
            }
            double range = max - min;
            for (int i = 0; i < n; i++) {
                double scaled = range > 0.0 ? (layout[i][c] - min) / range * INIT_SPREAD : INIT_SPREAD / 2.0;
                layout[i][c] = scaled + random.nextGaussian() * 1e-4;
            }
        }
        return layout;
    }

    private void optimizeLayout(double[][] embedding, List<Edge> graph, int nEpochs, Random random) {
        if (graph.isEmpty()) {
            return;
        }

        double maxWeight = graph.stream().mapToDouble(Edge::weight).max().orElse(1.0);
        List<Edge> edges = new ArrayList<>();
        for (Edge edge : graph) {
            if (edge.weight() >= maxWeight / nEpochs) {
                edges.add(edge);
            }
        }

        int n = embedding.length;
        int m = edges.size();
        double[] epochsPerSample = new double[m];
        double[] nextSample = new double[m];
        double[] epochsPerNegative = new double[m];
        double[] nextNegative = new double[m];
        for (int e = 0; e < m; e++) {
            epochsPerSample[e] = maxWeight / edges.get(e).weight();
            nextSample[e] = epochsPerSample[e];
            epochsPerNegative[e] = epochsPerSample[e] / NEGATIVE_SAMPLE_RATE;
            nextNegative[e] = epochsPerNegative[e];
        }

        for (int epoch = 0; epoch < nEpochs; epoch++) {
            double alpha = 1.0 - (double) epoch / nEpochs;

            for (int e = 0; e < m; e++) {
                if (nextSample[e] > epoch) {
                    continue;
                }
                double[] head = embedding[edges.get(e).head()];
                double[] tail = embedding[edges.get(e).tail()];

                double distSq = squaredDistance(head, tail);
                double attract = 0.0;
                if (distSq > 0.0) {
                    attract = -2.0 * a * b * Math.pow(distSq, b - 1.0) / (a * Math.pow(distSq, b) + 1.0);
                }
                for (int c = 0; c < components; c++) {
                    double grad = clip(attract * (head[c] - tail[c]));
                    head[c] += grad * alpha;
                    tail[c] -= grad * alpha;
                }
                nextSample[e] += epochsPerSample[e];

                int negatives = (int) ((epoch - nextNegative[e]) / epochsPerNegative[e]);
                for (int s = 0; s < negatives; s++) {
                    double[] other = embedding[random.nextInt(n)];
                    if (other == head) {
                        continue;
                    }
                    double negSq = squaredDistance(head, other);
                    double repel = 0.0;
                    if (negSq > 0.0) {
                        repel = 2.0 * b / ((0.001 + negSq) * (a * Math.pow(negSq, b) + 1.0));
                    }
                    for (int c = 0; c < components; c++) {
                        double grad = repel > 0.0 ? clip(repel * (head[c] - other[c])) : GRADIENT_CLIP;
                        head[c] += grad * alpha;
                    }
                }
                nextNegative[e] += negatives * epochsPerNegative[e];
            }
        }
    }

    private static double squaredDistance(double[] x, double[] y) {
        double sum = 0.0;
        for (int c = 0; c < x.length; c++) {
            double d = x[c] - y[c];
            sum += d * d;
        }
        return sum;
    }

    private static double clip(double value) {
        return Math.max(-GRADIENT_CLIP, Math.min(GRADIENT_CLIP, value));
    }

    /**
     * Fit {@code 1 / (1 + a * x^(2b))} to the target membership curve defined by
     * spread and min_dist. Least squares over a refined grid.
     */
    static double[] fitCurve(double spread, double minDist) {
        int samples = 300;
        double[] xs = new double[samples];
        double[] ys = new double[samples];
        for (int i = 0; i < samples; i++) {
            xs[i] = spread * 3.0 * i / (samples - 1);
            ys[i] = xs[i] < minDist ? 1.0 : Math.exp(-(xs[i] - minDist) / spread);
        }

        double bestA = 1.0;
        double bestB = 1.0;
        double aLo = 0.01;
        double aHi = 10.0;
        double bLo = 0.1;
        double bHi = 3.0;
        for (int round = 0; round < 6; round++) {
            double bestError = Double.POSITIVE_INFINITY;
            int steps = 40;
            for (int ia = 0; ia <= steps; ia++) {
                double ca = aLo + (aHi - aLo) * ia / steps;
                for (int ib = 0; ib <= steps; ib++) {
                    double cb = bLo + (bHi - bLo) * ib / steps;
                    double error = 0.0;
                    for (int i = 0; i < samples; i++) {
                        double predicted = 1.0 / (1.0 + ca * Math.pow(xs[i], 2 * cb));
                        double diff = predicted - ys[i];
                        error += diff * diff;
                    }
                    if (error < bestError) {
                        bestError = error;
                        bestA = ca;
                        bestB = cb;
                    }
                }
            }
            double aStep = (aHi - aLo) / steps;
            double bStep = (bHi - bLo) / steps;
            aLo = Math.max(1e-4, bestA - 2 * aStep);
            aHi = bestA + 2 * aStep;
            bLo = Math.max(1e-4, bestB - 2 * bStep);
            bHi = bestB + 2 * bStep;
        }
        return new double[]{bestA, bestB};
    }

    private record Edge(int head, int tail, double weight) {
    }
}
