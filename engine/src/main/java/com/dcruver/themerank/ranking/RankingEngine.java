package com.dcruver.themerank.ranking;

import com.dcruver.themerank.cluster.Cluster;
import com.dcruver.themerank.config.RankingProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.StageResult;
import com.dcruver.themerank.domain.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores clusters on independent quality dimensions and orders them.
 *
 * Each metric is computed in isolation on a 0-10 scale; a metric that cannot be
 * computed for a cluster scores 0 there without affecting the others. The final
 * score is the weighted sum of the clamped metrics, rounded to six decimals.
 * Order: final score descending, then size descending, then cluster id ascending.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RankingEngine {

    static final Comparator<RankedCluster> ORDER = Comparator
        .comparingDouble((RankedCluster r) -> r.getMetrics().getFinalScore()).reversed()
        .thenComparing(Comparator.comparingInt(RankedCluster::size).reversed())
        .thenComparingInt(RankedCluster::getClusterId);

    private final RankingProperties properties;
    private final NoiseDetector noiseDetector;

    /**
     * Rank labelled clusters. {@code documents} and {@code vectors} are the
     * run's full lists that cluster member indices refer to.
     */
    public StageResult<RankingResult> rank(List<Cluster> clusters, List<Document> documents,
                                           List<EmbeddingVector> vectors) {
        if (clusters == null || clusters.isEmpty()) {
            return StageResult.failure("No clusters to rank");
        }

        log.info("Ranking {} clusters", clusters.size());

        int totalMembers = clusters.stream().mapToInt(Cluster::size).sum();
        List<double[][]> memberRows = new ArrayList<>(clusters.size());
        List<double[]> centroids = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            double[][] rows = new double[cluster.size()][];
            for (int m = 0; m < cluster.size(); m++) {
                rows[m] = vectors.get(cluster.getMemberIndices().get(m)).toDoubleArray();
            }
            memberRows.add(rows);
            centroids.add(cluster.getCentroid().toDoubleArray());
        }

        double[] distinctiveness = distinctiveness(centroids);
        CorpusNoise corpusNoise = corpusNoise(memberRows);

        List<RankedCluster> scored = new ArrayList<>(clusters.size());
        int offset = 0;
        for (int c = 0; c < clusters.size(); c++) {
            Cluster cluster = clusters.get(c);
            double[][] rows = memberRows.get(c);
            double[] centroid = centroids.get(c);

            double coherence = safely("coherence", cluster, () -> coherence(rows, centroid));
            double demand = safely("demand", cluster, () -> totalMembers == 0 ? 0.0 : cluster.size() * 10.0 / totalMembers);
            double label = safely("label confidence", cluster, () -> labelConfidence(cluster, centroid));
            final int start = offset;
            double noise = safely("noise", cluster, () -> noiseScore(rows, corpusNoise, start));
            double pain = safely("pain intensity", cluster, () -> painIntensity(cluster, documents));
            offset += rows.length;

            scored.add(new RankedCluster(0, cluster, score(coherence, distinctiveness[c], demand, label, noise, pain)));
        }

        scored.sort(ORDER);
        List<RankedCluster> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            RankedCluster entry = scored.get(i);
            ranked.add(new RankedCluster(i + 1, entry.getCluster(), entry.getMetrics()));
        }

        return StageResult.success(RankingResult.builder()
            .rankings(List.copyOf(ranked))
            .metadata(RankingResult.Metadata.builder()
                .rankedAt(Instant.now())
                .totalClusters(ranked.size())
                .weightsUsed(weights())
                .painWeight(properties.getPainWeight())
                .painIncluded(properties.isIncludePainIntensity())
                .build())
            .build());
    }

    MetricSet score(double coherence, double distinctiveness, double demand,
                    double labelConfidence, double noiseScore, double painIntensity) {
        double c = clamp(coherence);
        double d = clamp(distinctiveness);
        double m = clamp(demand);
        double l = clamp(labelConfidence);
        double n = clamp(noiseScore);
        double p = clamp(painIntensity);

        double total = properties.getCoherenceWeight() * c
            + properties.getDistinctivenessWeight() * d
            + properties.getDemandWeight() * m
            + properties.getLabelConfidenceWeight() * l;
        if (properties.isIncludePainIntensity()) {
            total += properties.getPainWeight() * p;
        }

        return MetricSet.builder()
            .coherence(c)
            .distinctiveness(d)
            .demand(m)
            .labelConfidence(l)
            .noiseScore(n)
            .painIntensity(p)
            .finalScore(Math.round(total * 1e6) / 1e6)
            .build();
    }

    private static double coherence(double[][] rows, double[] centroid) {
        if (rows.length == 0) {
            return 0.0;
        }
        if (rows.length == 1) {
            return 10.0;
        }
        double sum = 0.0;
        for (double[] row : rows) {
            sum += (VectorMath.cosine(row, centroid) + 1.0) / 2.0 * 10.0;
        }
        return sum / rows.length;
    }

    /**
     * Mean distance to the other centroids, min-max scaled across the run
     */
    private static double[] distinctiveness(List<double[]> centroids) {
        int k = centroids.size();
        double[] scaled = new double[k];
        if (k < 2) {
            return scaled;
        }

        double[] raw = new double[k];
        for (int i = 0; i < k; i++) {
            double sum = 0.0;
            for (int j = 0; j < k; j++) {
                if (i != j) {
                    sum += VectorMath.euclidean(centroids.get(i), centroids.get(j));
                }
            }
            raw[i] = sum / (k - 1);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : raw) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        for (int i = 0; i < k; i++) {
            scaled[i] = Math.abs(max - min) < 1e-12 ? 5.0 : (raw[i] - min) / (max - min) * 10.0;
        }
        return scaled;
    }

    private double labelConfidence(Cluster cluster, double[] centroid) {
        if (!cluster.hasLabel() || cluster.getLabelVector() == null) {
            return 0.0;
        }
        double[] label = cluster.getLabelVector().toDoubleArray();
        if (label.length != centroid.length) {
            return 0.0;
        }
        return (VectorMath.cosine(label, centroid) + 1.0) / 2.0 * 10.0;
    }

    private double noiseScore(double[][] rows, CorpusNoise corpus, int offset) {
        int size = rows.length;
        if (size == 0) {
            return 0.0;
        }

        boolean[] outliers;
        try {
            int k = properties.getKForEps();
            double eps;
            if (size > k) {
                eps = noiseDetector.estimateEps(rows, Math.min(k, size - 1));
            } else if (corpus.eps() != null) {
                eps = corpus.eps();
            } else {
                eps = properties.getDefaultEps();
            }
            outliers = noiseDetector.dbscanOutliers(rows, eps);
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.warn("DBSCAN re-pass failed, using LOF scores: {}", e.getMessage());
            if (corpus.lof() == null) {
                outliers = new boolean[size];
            } else {
                double[] slice = new double[size];
                System.arraycopy(corpus.lof(), offset, slice, 0, size);
                outliers = noiseDetector.belowPercentile(slice, properties.getLofOutlierPercentile());
            }
        }

        int flagged = 0;
        for (boolean outlier : outliers) {
            if (outlier) {
                flagged++;
            }
        }
        return 10.0 - 10.0 * flagged / size;
    }

    private double painIntensity(Cluster cluster, List<Document> documents) {
        List<Integer> members = cluster.getMemberIndices();
        if (members.isEmpty()) {
            return 0.0;
        }
        List<String> lexicon = properties.getPainLexicon().stream()
            .map(term -> term.toLowerCase(Locale.ROOT))
            .toList();

        int painful = 0;
        for (int index : members) {
            String text = documents.get(index).getText();
            String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
            if (lexicon.stream().anyMatch(lower::contains)) {
                painful++;
            }
        }
        return painful * 10.0 / members.size();
    }

    private CorpusNoise corpusNoise(List<double[][]> memberRows) {
        List<double[]> all = new ArrayList<>();
        for (double[][] rows : memberRows) {
            all.addAll(List.of(rows));
        }
        double[][] corpus = all.toArray(new double[0][]);
        if (corpus.length == 0) {
            return new CorpusNoise(null, null);
        }

        Double eps = null;
        double[] lof = null;
        try {
            eps = noiseDetector.estimateEps(corpus, properties.getKForEps());
        } catch (ArithmeticException e) {
            log.warn("Corpus-wide eps estimate failed: {}", e.getMessage());
        }
        try {
            lof = noiseDetector.lofCleanliness(corpus);
        } catch (ArithmeticException e) {
            log.warn("Corpus-wide LOF scoring failed: {}", e.getMessage());
        }
        return new CorpusNoise(eps, lof);
    }

    private Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("coherence", properties.getCoherenceWeight());
        weights.put("distinctiveness", properties.getDistinctivenessWeight());
        weights.put("demand", properties.getDemandWeight());
        weights.put("label_confidence", properties.getLabelConfidenceWeight());
        return weights;
    }

    private static double safely(String metric, Cluster cluster, MetricComputation computation) {
        try {
            double value = computation.compute();
            return Double.isFinite(value) ? value : 0.0;
        } catch (RuntimeException e) {
            log.warn("Could not compute {} for cluster {}: {}", metric, cluster.getId(), e.getMessage());
            return 0.0;
        }
    }

    private static double clamp(double value) {
        return VectorMath.clamp(value, 0.0, 10.0);
    }

    @FunctionalInterface
    private interface MetricComputation {
        double compute();
    }

    private record CorpusNoise(Double eps, double[] lof) {
    }
}
