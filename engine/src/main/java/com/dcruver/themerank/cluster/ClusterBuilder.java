package com.dcruver.themerank.cluster;

import com.dcruver.themerank.config.ClusteringProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.StageResult;
import com.dcruver.themerank.domain.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups documents into topical clusters.
 *
 * Embeddings are reduced first (PCA for tiny corpora, UMAP otherwise), each
 * reduced row is scaled to unit length, and the result is clustered with
 * HDBSCAN. Parameters shrink with the corpus size so small runs still get a
 * usable partition.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClusterBuilder {

    private final ClusteringProperties properties;

    /**
     * Cluster the documents. {@code vectors.get(i)} is the embedding of
     * {@code documents.get(i)}; member indices in the result refer to the same
     * positions. Documents with blank text or an empty vector are left out.
     */
    public StageResult<ClusterSummary> build(List<Document> documents, List<EmbeddingVector> vectors) {
        if (documents.size() != vectors.size()) {
            return StageResult.failure("Got %d documents but %d embeddings", documents.size(), vectors.size());
        }

        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            if (documents.get(i).isValid() && vectors.get(i) != null && !vectors.get(i).isEmpty()) {
                valid.add(i);
            }
        }

        int n = valid.size();
        if (n < properties.getMinDocuments()) {
            log.warn("Insufficient data for clustering: {} valid documents (need {})", n, properties.getMinDocuments());
            return StageResult.failure("Insufficient data for clustering: %d valid documents, at least %d required",
                n, properties.getMinDocuments());
        }

        try {
            return StageResult.success(cluster(documents, vectors, valid));
        } catch (ArithmeticException | IllegalArgumentException | IllegalStateException e) {
            log.error("Clustering failed: {}", e.getMessage(), e);
            return StageResult.failure("Clustering failed: " + e.getMessage());
        }
    }

    private ClusterSummary cluster(List<Document> documents, List<EmbeddingVector> vectors, List<Integer> valid) {
        int n = valid.size();
        double[][] embeddings = new double[n][];
        int dimension = vectors.get(valid.get(0)).dimension();
        for (int row = 0; row < n; row++) {
            EmbeddingVector vector = vectors.get(valid.get(row));
            if (vector.dimension() != dimension) {
                throw new IllegalArgumentException(String.format(
                    "Embedding dimension mismatch: expected %d, got %d", dimension, vector.dimension()));
            }
            embeddings[row] = vector.toDoubleArray();
        }

        DimensionReducer reducer = reducerFor(n, dimension);
        log.info("Reducing {} embeddings ({}d) with {} to {} components", n, dimension, reducer.name(), reducer.components());
        double[][] reduced = VectorMath.normalizeRows(reducer.reduce(embeddings));
        requireFinite(reduced);

        int minClusterSize = Math.min(properties.getMinClusterSize(), Math.max(3, n / 10));
        Hdbscan hdbscan = new Hdbscan(minClusterSize, properties.getMinSamples(), properties.isAllowSingleCluster());
        int[] labels = hdbscan.fit(reduced);

        Map<Integer, List<Integer>> rowsByLabel = new TreeMap<>();
        List<Integer> noise = new ArrayList<>();
        for (int row = 0; row < n; row++) {
            if (labels[row] == Hdbscan.NOISE) {
                noise.add(valid.get(row));
            } else {
                rowsByLabel.computeIfAbsent(labels[row], key -> new ArrayList<>()).add(row);
            }
        }

        List<Cluster> clusters = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : rowsByLabel.entrySet()) {
            clusters.add(toCluster(entry.getKey(), entry.getValue(), valid, embeddings, documents, dimension, n));
        }

        int clustered = n - noise.size();
        log.info("Found {} clusters over {} documents ({} clustered, {} noise, min cluster size {})",
            clusters.size(), n, clustered, noise.size(), minClusterSize);

        return ClusterSummary.builder()
            .clusters(List.copyOf(clusters))
            .noiseIndices(List.copyOf(noise))
            .statistics(ClusterSummary.Statistics.builder()
                .totalDocuments(n)
                .clusteredDocuments(clustered)
                .noiseDocuments(noise.size())
                .clusterCount(clusters.size())
                .build())
            .metadata(ClusterSummary.Metadata.builder()
                .createdAt(Instant.now())
                .reducer(reducer.name())
                .components(reducer.components())
                .neighbors(reducer instanceof UmapReducer umap ? umap.neighbors() : 0)
                .minClusterSize(minClusterSize)
                .minSamples(properties.getMinSamples())
                .randomSeed(properties.getRandomSeed())
                .build())
            .build();
    }

    private DimensionReducer reducerFor(int n, int dimension) {
        if (n < properties.getPcaThreshold()) {
            int components = Math.max(1, Math.min(properties.getPcaMaxComponents(), Math.min(n - 1, dimension)));
            return new PcaReducer(components);
        }
        int neighbors = Math.min(properties.getUmapNeighbors(), Math.min(n - 1, properties.getUmapNeighborsCap()));
        int components = Math.min(properties.getUmapComponents(), Math.min(n - 1, properties.getUmapComponentsCap()));
        return new UmapReducer(neighbors, components, properties.getUmapMinDist(),
            properties.getUmapEpochs(), properties.getRandomSeed());
    }

    private Cluster toCluster(int id, List<Integer> rows, List<Integer> valid, double[][] embeddings,
                              List<Document> documents, int dimension, int n) {
        List<Integer> members = new ArrayList<>(rows.size());
        double[][] memberVectors = new double[rows.size()][];
        List<String> samples = new ArrayList<>();
        for (int m = 0; m < rows.size(); m++) {
            int documentIndex = valid.get(rows.get(m));
            members.add(documentIndex);
            memberVectors[m] = embeddings[rows.get(m)];
            if (samples.size() < properties.getSampleSize()) {
                samples.add(documents.get(documentIndex).getText());
            }
        }

        double percentage = Math.round(rows.size() * 10000.0 / n) / 100.0;
        return Cluster.builder()
            .id(id)
            .memberIndices(List.copyOf(members))
            .centroid(EmbeddingVector.of(VectorMath.centroid(memberVectors, dimension)))
            .percentage(percentage)
            .sampleTexts(List.copyOf(samples))
            .build();
    }

    private static void requireFinite(double[][] rows) {
        for (double[] row : rows) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new ArithmeticException("Dimensionality reduction produced non-finite values");
                }
            }
        }
    }
}
