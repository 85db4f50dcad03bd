package com.dcruver.themerank.cluster;

import com.dcruver.themerank.domain.VectorMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical density-based clustering with excess-of-mass selection.
 *
 * <ol>
 *   <li>Core distance of a point: Euclidean distance to its
 *       {@code minSamples - 1}-th nearest other point.</li>
 *   <li>Minimum spanning tree (Prim) over mutual reachability
 *       {@code max(core(a), core(b), d(a, b))}.</li>
 *   <li>Single-linkage hierarchy from the sorted MST edges (union-find).</li>
 *   <li>Condensed tree: a split counts only when both sides hold at least
 *       {@code minClusterSize} points; smaller sides fall out as points.</li>
 *   <li>Excess-of-mass selection over the condensed clusters, root excluded.</li>
 * </ol>
 *
 * When the condensed tree never splits and {@code allowSingleCluster} is set,
 * the root becomes the one cluster, but only for points that stay in it up to
 * its densest level. Points that fell out earlier, as undersized pieces, stay
 * {@link #NOISE} like every other unselected point.
 */
public class Hdbscan {

    public static final int NOISE = -1;

    private static final double MAX_LAMBDA = 1e12;

    private final int minClusterSize;
    private final int minSamples;
    private final boolean allowSingleCluster;

    public Hdbscan(int minClusterSize, int minSamples, boolean allowSingleCluster) {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2");
        }
        this.minClusterSize = minClusterSize;
        this.minSamples = Math.max(1, minSamples);
        this.allowSingleCluster = allowSingleCluster;
    }

    /**
     * Cluster labels per row: 0..k-1 ordered by each cluster's lowest member
     * index, or {@link #NOISE}.
     */
    public int[] fit(double[][] points) {
        int n = points.length;
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n == 0) {
            return labels;
        }
        if (n == 1) {
            if (allowSingleCluster) {
                labels[0] = 0;
            }
            return labels;
        }

        double[][] distances = pairwiseDistances(points);
        double[] core = coreDistances(distances);
        double[][] mst = minimumSpanningTree(distances, core);
        LinkageTree linkage = singleLinkage(mst, n);
        CondensedTree condensed = condense(linkage, n);

        if (!condensed.hasSplit()) {
            if (allowSingleCluster) {
                double densest = condensed.maxPointLambda();
                for (int point = 0; point < n; point++) {
                    if (condensed.pointLambda[point] >= densest) {
                        labels[point] = 0;
                    }
                }
            }
            return labels;
        }

        List<Integer> selected = selectClusters(condensed);
        return label(condensed, selected, n);
    }

    private static double[][] pairwiseDistances(double[][] points) {
        int n = points.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = VectorMath.euclidean(points[i], points[j]);
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return distances;
    }

    private double[] coreDistances(double[][] distances) {
        int n = distances.length;
        int rank = Math.min(minSamples - 1, n - 1);
        double[] core = new double[n];
        if (rank == 0) {
            return core;
        }
        for (int i = 0; i < n; i++) {
            double[] others = new double[n - 1];
            int m = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    others[m++] = distances[i][j];
                }
            }
            Arrays.sort(others);
            core[i] = others[rank - 1];
        }
        return core;
    }

    /**
     * Prim over the dense mutual reachability graph. Rows are {from, to, weight}.
     */
    private static double[][] minimumSpanningTree(double[][] distances, double[] core) {
        int n = distances.length;
        boolean[] inTree = new boolean[n];
        double[] best = new double[n];
        int[] parent = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);

        double[][] edges = new double[n - 1][];
        int current = 0;
        inTree[0] = true;
        for (int e = 0; e < n - 1; e++) {
            for (int j = 0; j < n; j++) {
                if (inTree[j]) {
                    continue;
                }
                double reach = Math.max(distances[current][j], Math.max(core[current], core[j]));
                if (reach < best[j]) {
                    best[j] = reach;
                    parent[j] = current;
                }
            }
            int next = -1;
            for (int j = 0; j < n; j++) {
                if (!inTree[j] && (next < 0 || best[j] < best[next])) {
                    next = j;
                }
            }
            inTree[next] = true;
            edges[e] = new double[]{parent[next], next, best[next]};
            current = next;
        }
        return edges;
    }

    private static LinkageTree singleLinkage(double[][] mst, int n) {
        double[][] sorted = mst.clone();
        Arrays.sort(sorted, Comparator.comparingDouble((double[] e) -> e[2]));

        LinkageTree tree = new LinkageTree(n);
        int[] parent = new int[2 * n - 1];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        int next = n;
        for (double[] edge : sorted) {
            int a = find(parent, (int) edge[0]);
            int b = find(parent, (int) edge[1]);
            tree.left[next - n] = a;
            tree.right[next - n] = b;
            tree.distance[next - n] = edge[2];
            tree.size[next - n] = tree.sizeOf(a) + tree.sizeOf(b);
            parent[a] = next;
            parent[b] = next;
            next++;
        }
        return tree;
    }

    private static int find(int[] parent, int node) {
        int root = node;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[node] != root) {
            int up = parent[node];
            parent[node] = root;
            node = up;
        }
        return root;
    }

    private CondensedTree condense(LinkageTree linkage, int n) {
        CondensedTree condensed = new CondensedTree(n);
        int rootNode = 2 * n - 2;

        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{rootNode, CondensedTree.ROOT});
        while (!stack.isEmpty()) {
            int[] frame = stack.pop();
            int node = frame[0];
            int cluster = frame[1];
            if (node < n) {
                continue;
            }

            int left = linkage.left[node - n];
            int right = linkage.right[node - n];
            double d = linkage.distance[node - n];
            double lambda = d > 0.0 ? Math.min(MAX_LAMBDA, 1.0 / d) : MAX_LAMBDA;
            int leftSize = linkage.sizeOf(left);
            int rightSize = linkage.sizeOf(right);

            boolean leftBig = leftSize >= minClusterSize;
            boolean rightBig = rightSize >= minClusterSize;

            if (leftBig && rightBig) {
                int leftCluster = condensed.addCluster(cluster, lambda, leftSize);
                int rightCluster = condensed.addCluster(cluster, lambda, rightSize);
                stack.push(new int[]{right, rightCluster});
                stack.push(new int[]{left, leftCluster});
            } else {
                if (leftBig) {
                    stack.push(new int[]{left, cluster});
                } else {
                    for (int point : linkage.leaves(left)) {
                        condensed.addPoint(cluster, point, lambda);
                    }
                }
                if (rightBig) {
                    stack.push(new int[]{right, cluster});
                } else {
                    for (int point : linkage.leaves(right)) {
                        condensed.addPoint(cluster, point, lambda);
                    }
                }
            }
        }
        return condensed;
    }

    /**
     * Excess of mass. Children always carry larger ids than their parent, so a
     * descending sweep sees every subtree before its root.
     */
    private static List<Integer> selectClusters(CondensedTree tree) {
        int count = tree.clusterCount();
        double[] stability = tree.stabilities();
        boolean[] selected = new boolean[count];

        for (int c = count - 1; c > CondensedTree.ROOT; c--) {
            double childSum = 0.0;
            for (int child : tree.children(c)) {
                childSum += stability[child];
            }
            if (tree.children(c).isEmpty() || stability[c] >= childSum) {
                selected[c] = true;
                for (int descendant : tree.descendants(c)) {
                    selected[descendant] = false;
                }
            } else {
                stability[c] = childSum;
            }
        }

        List<Integer> result = new ArrayList<>();
        for (int c = CondensedTree.ROOT + 1; c < count; c++) {
            if (selected[c]) {
                result.add(c);
            }
        }
        return result;
    }

    private static int[] label(CondensedTree tree, List<Integer> selected, int n) {
        int[] owner = new int[tree.clusterCount()];
        Arrays.fill(owner, -1);
        for (int cluster : selected) {
            owner[cluster] = cluster;
            for (int descendant : tree.descendants(cluster)) {
                owner[descendant] = cluster;
            }
        }

        int[] raw = new int[n];
        for (int point = 0; point < n; point++) {
            raw[point] = owner[tree.pointCluster[point]];
        }

        Map<Integer, Integer> dense = new HashMap<>();
        int[] labels = new int[n];
        for (int point = 0; point < n; point++) {
            if (raw[point] < 0) {
                labels[point] = NOISE;
            } else {
                labels[point] = dense.computeIfAbsent(raw[point], key -> dense.size());
            }
        }
        return labels;
    }

    /**
     * Single-linkage dendrogram. Node ids below n are points; node n + i is merge i.
     */
    private static final class LinkageTree {
        private final int n;
        private final int[] left;
        private final int[] right;
        private final double[] distance;
        private final int[] size;

        private LinkageTree(int n) {
            this.n = n;
            this.left = new int[n - 1];
            this.right = new int[n - 1];
            this.distance = new double[n - 1];
            this.size = new int[n - 1];
        }

        private int sizeOf(int node) {
            return node < n ? 1 : size[node - n];
        }

        private List<Integer> leaves(int node) {
            List<Integer> leaves = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(node);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                if (current < n) {
                    leaves.add(current);
                } else {
                    stack.push(right[current - n]);
                    stack.push(left[current - n]);
                }
            }
            return leaves;
        }
    }

    /**
     * Condensed cluster hierarchy. Cluster 0 is the root.
     */
    private static final class CondensedTree {
        private static final int ROOT = 0;

        private final List<Integer> parents = new ArrayList<>();
        private final List<Double> birthLambdas = new ArrayList<>();
        private final List<List<Integer>> childClusters = new ArrayList<>();
        private final List<Double> childExcess = new ArrayList<>();

        private final int[] pointCluster;
        private final double[] pointLambda;

        private CondensedTree(int n) {
            this.pointCluster = new int[n];
            this.pointLambda = new double[n];
            parents.add(-1);
            birthLambdas.add(0.0);
            childClusters.add(new ArrayList<>());
            childExcess.add(0.0);
        }

        private int addCluster(int parent, double lambda, int size) {
            int id = parents.size();
            parents.add(parent);
            birthLambdas.add(lambda);
            childClusters.add(new ArrayList<>());
            childExcess.add(0.0);
            childClusters.get(parent).add(id);
            childExcess.set(parent, childExcess.get(parent) + (lambda - birthLambdas.get(parent)) * size);
            return id;
        }

        private void addPoint(int cluster, int point, double lambda) {
            pointCluster[point] = cluster;
            pointLambda[point] = lambda;
            childExcess.set(cluster, childExcess.get(cluster) + (lambda - birthLambdas.get(cluster)));
        }

        private double maxPointLambda() {
            double max = 0.0;
            for (double lambda : pointLambda) {
                max = Math.max(max, lambda);
            }
            return max;
        }

        private boolean hasSplit() {
            return parents.size() > 1;
        }

        private int clusterCount() {
            return parents.size();
        }

        private List<Integer> children(int cluster) {
            return childClusters.get(cluster);
        }

        private List<Integer> descendants(int cluster) {
            List<Integer> result = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>(childClusters.get(cluster));
            while (!stack.isEmpty()) {
                int current = stack.pop();
                result.add(current);
                stack.addAll(childClusters.get(current));
            }
            return result;
        }

        private double[] stabilities() {
            double[] stability = new double[parents.size()];
            for (int c = 0; c < stability.length; c++) {
                stability[c] = childExcess.get(c);
            }
            return stability;
        }
    }
}
