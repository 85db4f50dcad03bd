package com.dcruver.themerank.cluster;

import com.dcruver.themerank.config.ClusteringProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reduction plus density clustering over small corpora.
 */
class ClusterBuilderTest {

    private ClusterBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ClusterBuilder(new ClusteringProperties());
    }

    private static Document doc(String id, String text) {
        return Document.builder().id(id).text(text).build();
    }

    private static ClusterSummary unwrap(StageResult<ClusterSummary> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        return ((StageResult.Success<ClusterSummary>) result).value();
    }

    @Test
    void testIdenticalDocumentsFormOneCluster() {
        List<Document> docs = List.of(
            doc("p1", "the app crashes on startup"),
            doc("p2", "the app crashes on startup"),
            doc("p3", "the app crashes on startup"));
        EmbeddingVector v = EmbeddingVector.of(new float[]{0.3f, 0.4f, 0.5f});

        ClusterSummary summary = unwrap(builder.build(docs, List.of(v, v, v)));

        assertEquals(1, summary.clusterCount());
        Cluster cluster = summary.getClusters().get(0);
        assertEquals(0, cluster.getId());
        assertEquals(List.of(0, 1, 2), cluster.getMemberIndices());
        assertEquals(100.0, cluster.getPercentage(), 1e-9);
        assertEquals(1.0, cluster.getCentroid().norm(), 1e-6);
        assertEquals(1.0, cluster.getCentroid().cosineSimilarity(v), 1e-6);
        assertEquals(3, summary.getStatistics().getClusteredDocuments());
        assertTrue(summary.getNoiseIndices().isEmpty());
        assertEquals("pca", summary.getMetadata().getReducer());
    }

    @Test
    void testTooFewDocumentsFails() {
        List<Document> docs = List.of(doc("p1", "slow sync"), doc("p2", "sync is slow"));
        EmbeddingVector v = EmbeddingVector.of(new float[]{1f, 0f});

        StageResult<ClusterSummary> result = builder.build(docs, List.of(v, v));

        StageResult.Failure<ClusterSummary> failure = assertInstanceOf(StageResult.Failure.class, result);
        assertTrue(failure.reason().startsWith("Insufficient data for clustering"));
    }

    @Test
    void testBlankDocumentsDoNotCount() {
        List<Document> docs = List.of(doc("p1", "slow sync"), doc("p2", "   "), doc("p3", "sync is slow"));
        EmbeddingVector v = EmbeddingVector.of(new float[]{1f, 0f});

        assertFalse(builder.build(docs, List.of(v, v, v)).isSuccess());
    }

    @Test
    void testMismatchedInputsFail() {
        List<Document> docs = List.of(doc("p1", "a"), doc("p2", "b"), doc("p3", "c"));
        EmbeddingVector v = EmbeddingVector.of(new float[]{1f, 0f});

        assertFalse(builder.build(docs, List.of(v, v)).isSuccess());
    }

    @Test
    void testSeparatedGroupsStayPure() {
        List<Document> docs = new ArrayList<>();
        List<EmbeddingVector> vectors = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            docs.add(doc("login-" + i, "cannot log in " + i));
            vectors.add(EmbeddingVector.of(new double[]{1.0, 0.01 * i, 0.02 * (i % 3), 0.0}));
        }
        for (int i = 0; i < 6; i++) {
            docs.add(doc("price-" + i, "too expensive " + i));
            vectors.add(EmbeddingVector.of(new double[]{0.01 * i, 1.0, 0.0, 0.02 * (i % 2)}));
        }

        ClusterSummary summary = unwrap(builder.build(docs, vectors));

        assertTrue(summary.clusterCount() >= 2);
        Set<Integer> seen = new HashSet<>();
        for (Cluster cluster : summary.getClusters()) {
            Set<Boolean> groups = new HashSet<>();
            for (int index : cluster.getMemberIndices()) {
                groups.add(index < 6);
                assertTrue(seen.add(index), "document in two clusters: " + index);
            }
            assertEquals(1, groups.size(), "cluster mixes groups: " + cluster.getMemberIndices());
        }
        assertEquals(12, seen.size() + summary.getNoiseIndices().size());
    }

    @Test
    void testLargerCorpusIsDeterministic() {
        List<Document> docs = new ArrayList<>();
        List<EmbeddingVector> vectors = new ArrayList<>();
        double[][] anchors = {{1, 0, 0, 0, 0}, {0, 1, 0, 0, 0}, {0, 0, 1, 0, 0}};
        for (int g = 0; g < anchors.length; g++) {
            for (int i = 0; i < 8; i++) {
                double[] v = anchors[g].clone();
                v[3] = 0.03 * i;
                v[4] = 0.02 * ((i + g) % 4);
                docs.add(doc("g" + g + "-" + i, "post " + g + " " + i));
                vectors.add(EmbeddingVector.of(v));
            }
        }

        ClusterSummary first = unwrap(builder.build(docs, vectors));
        ClusterSummary second = unwrap(builder.build(docs, vectors));

        assertEquals("umap", first.getMetadata().getReducer());
        assertEquals(first.clusterCount(), second.clusterCount());
        for (int c = 0; c < first.clusterCount(); c++) {
            assertEquals(first.getClusters().get(c).getMemberIndices(), second.getClusters().get(c).getMemberIndices());
        }
        assertEquals(first.getNoiseIndices(), second.getNoiseIndices());
        assertEquals(24, first.getStatistics().getTotalDocuments());
    }
}
