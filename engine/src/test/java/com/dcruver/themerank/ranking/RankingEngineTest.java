package com.dcruver.themerank.ranking;

import com.dcruver.themerank.cluster.Cluster;
import com.dcruver.themerank.config.RankingProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for cluster scoring and ordering.
 */
class RankingEngineTest {

    private static final EmbeddingVector LOGIN = EmbeddingVector.of(new float[]{0.6f, 0.8f, 0f});
    private static final EmbeddingVector PRICE = EmbeddingVector.of(new float[]{0f, 0.6f, 0.8f});

    private RankingProperties properties;
    private RankingEngine engine;

    @BeforeEach
    void setUp() {
        properties = new RankingProperties();
        engine = new RankingEngine(properties, new NoiseDetector(properties));
    }

    private static Document doc(String id, String text) {
        return Document.builder().id(id).text(text).build();
    }

    private static Cluster cluster(int id, List<Integer> members, EmbeddingVector centroid, String label) {
        return cluster(id, members, centroid, label, null);
    }

    private static Cluster cluster(int id, List<Integer> members, EmbeddingVector centroid, String label,
                                   EmbeddingVector labelVector) {
        return Cluster.builder()
            .id(id)
            .memberIndices(members)
            .centroid(centroid)
            .percentage(0.0)
            .sampleTexts(List.of())
            .label(label)
            .labelVector(labelVector)
            .build();
    }

    private static RankingResult unwrap(StageResult<RankingResult> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        return ((StageResult.Success<RankingResult>) result).value();
    }

    @Test
    void testSingleIdenticalCluster() {
        List<Document> docs = List.of(
            doc("p1", "the app crashes on startup"),
            doc("p2", "the app crashes on startup"),
            doc("p3", "the app crashes on startup"));
        List<EmbeddingVector> vectors = List.of(LOGIN, LOGIN, LOGIN);

        RankingResult result = unwrap(engine.rank(List.of(cluster(0, List.of(0, 1, 2), LOGIN, null)), docs, vectors));

        assertEquals(1, result.getRankings().size());
        RankedCluster top = result.getRankings().get(0);
        MetricSet m = top.getMetrics();
        assertEquals(1, top.getRank());
        assertEquals(10.0, m.getDemand(), 1e-9);
        assertEquals(10.0, m.getCoherence(), 1e-6);
        assertEquals(0.0, m.getDistinctiveness(), 1e-9);
        assertEquals(0.0, m.getLabelConfidence(), 1e-9);
        assertEquals(10.0, m.getNoiseScore(), 1e-9);
        assertEquals(10.0, m.getPainIntensity(), 1e-9);
        assertEquals(6.5, m.getFinalScore(), 1e-5);
        assertEquals(1, result.getMetadata().getTotalClusters());
        assertTrue(result.getMetadata().isPainIncluded());
    }

    @Test
    void testNoClustersFails() {
        StageResult<RankingResult> result = engine.rank(List.of(), List.of(), List.of());

        StageResult.Failure<RankingResult> failure = assertInstanceOf(StageResult.Failure.class, result);
        assertEquals("No clusters to rank", failure.reason());
    }

    @Test
    void testLargerClusterRanksFirst() {
        List<Document> docs = new ArrayList<>();
        List<EmbeddingVector> vectors = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            docs.add(doc("login-" + i, "login keeps failing"));
            vectors.add(LOGIN);
        }
        for (int i = 0; i < 2; i++) {
            docs.add(doc("price-" + i, "pricing is too high"));
            vectors.add(PRICE);
        }
        List<Cluster> clusters = List.of(
            cluster(0, List.of(4, 5), PRICE, null),
            cluster(1, List.of(0, 1, 2, 3), LOGIN, null));

        RankingResult result = unwrap(engine.rank(clusters, docs, vectors));

        assertEquals(List.of(1, 0), result.getRankings().stream().map(RankedCluster::getClusterId).toList());
        assertEquals(List.of(1, 2), result.getRankings().stream().map(RankedCluster::getRank).toList());
        RankedCluster login = result.getRankings().get(0);
        assertEquals(10.0 * 4 / 6, login.getMetrics().getDemand(), 1e-9);
        // two clusters are equally far from each other
        assertEquals(5.0, login.getMetrics().getDistinctiveness(), 1e-9);
    }

    @Test
    void testLabelConfidenceUsesLabelEmbedding() {
        List<Document> docs = List.of(doc("p1", "login"), doc("p2", "login"), doc("p3", "login"));

        RankingResult result = unwrap(engine.rank(
            List.of(cluster(0, List.of(0, 1, 2), LOGIN, "Login failures", LOGIN)), docs, List.of(LOGIN, LOGIN, LOGIN)));

        assertEquals(10.0, result.getRankings().get(0).getMetrics().getLabelConfidence(), 1e-6);
    }

    @Test
    void testOrthogonalLabelScoresHalfConfidence() {
        EmbeddingVector unrelated = EmbeddingVector.of(new float[]{0.8f, -0.6f, 0f});
        List<Document> docs = List.of(doc("p1", "login"), doc("p2", "login"), doc("p3", "login"));

        RankingResult result = unwrap(engine.rank(
            List.of(cluster(0, List.of(0, 1, 2), LOGIN, "Pricing", unrelated)), docs, List.of(LOGIN, LOGIN, LOGIN)));

        assertEquals(5.0, result.getRankings().get(0).getMetrics().getLabelConfidence(), 1e-6);
    }

    @Test
    void testLabelWithoutEmbeddingScoresZero() {
        List<Document> docs = List.of(doc("p1", "login"), doc("p2", "login"), doc("p3", "login"));

        RankingResult result = unwrap(engine.rank(
            List.of(cluster(0, List.of(0, 1, 2), LOGIN, "Login failures")), docs, List.of(LOGIN, LOGIN, LOGIN)));

        assertEquals(0.0, result.getRankings().get(0).getMetrics().getLabelConfidence(), 1e-9);
    }

    @Test
    void testFailingMetricScoresZeroWithoutFailingRanking() {
        EmbeddingVector wrongDimension = EmbeddingVector.of(new float[]{1f, 0f});
        List<Document> docs = List.of(doc("p1", "login"), doc("p2", "login"), doc("p3", "login"));

        RankingResult result = unwrap(engine.rank(
            List.of(cluster(0, List.of(0, 1, 2), LOGIN, "Login failures", wrongDimension)),
            docs, List.of(LOGIN, LOGIN, LOGIN)));

        MetricSet m = result.getRankings().get(0).getMetrics();
        assertEquals(0.0, m.getLabelConfidence(), 1e-9);
        assertEquals(10.0, m.getDemand(), 1e-9);
    }

    @Test
    void testPainIntensityCountsMembersWithPainTerms() {
        List<Document> docs = List.of(
            doc("p1", "This is so FRUSTRATING"),
            doc("p2", "love the new theme"),
            doc("p3", "export is broken again"),
            doc("p4", "nice update"));
        List<EmbeddingVector> vectors = List.of(LOGIN, LOGIN, LOGIN, LOGIN);

        RankingResult result = unwrap(engine.rank(List.of(cluster(0, List.of(0, 1, 2, 3), LOGIN, null)), docs, vectors));

        assertEquals(5.0, result.getRankings().get(0).getMetrics().getPainIntensity(), 1e-9);
    }

    @Test
    void testScoreClampsInputs() {
        MetricSet m = engine.score(12.0, -3.0, 5.0, 5.0, 42.0, 5.0);

        assertEquals(10.0, m.getCoherence());
        assertEquals(0.0, m.getDistinctiveness());
        assertEquals(10.0, m.getNoiseScore());
        assertEquals(0.35 * 10 + 0.25 * 5 + 0.15 * 5 + 0.05 * 5, m.getFinalScore(), 1e-9);
    }

    @Test
    void testScoreIsMonotonicInEachWeightedMetric() {
        double base = engine.score(5, 5, 5, 5, 5, 5).getFinalScore();

        assertTrue(engine.score(6, 5, 5, 5, 5, 5).getFinalScore() > base);
        assertTrue(engine.score(5, 6, 5, 5, 5, 5).getFinalScore() > base);
        assertTrue(engine.score(5, 5, 6, 5, 5, 5).getFinalScore() > base);
        assertTrue(engine.score(5, 5, 5, 6, 5, 5).getFinalScore() > base);
        assertTrue(engine.score(5, 5, 5, 5, 5, 6).getFinalScore() > base);
        // noise is reported but not weighted
        assertEquals(base, engine.score(5, 5, 5, 5, 9, 5).getFinalScore());
    }

    @Test
    void testPainExcludedWhenDisabled() {
        properties.setIncludePainIntensity(false);

        MetricSet m = engine.score(10, 10, 10, 10, 10, 10);

        assertEquals(10.0, m.getFinalScore(), 1e-9);
    }

    @Test
    void testScoreIsRoundedToSixDecimals() {
        double score = engine.score(1.0 / 3.0, 0, 0, 0, 0, 0).getFinalScore();

        assertEquals(Math.round(score * 1e6) / 1e6, score);
    }

    @Test
    void testOrderBreaksTiesBySizeThenId() {
        MetricSet same = engine.score(5, 5, 5, 5, 5, 5);
        RankedCluster small = new RankedCluster(0, cluster(0, List.of(0), LOGIN, null), same);
        RankedCluster bigLowId = new RankedCluster(0, cluster(1, List.of(1, 2), LOGIN, null), same);
        RankedCluster bigHighId = new RankedCluster(0, cluster(2, List.of(3, 4), LOGIN, null), same);

        List<RankedCluster> sorted = new ArrayList<>(List.of(small, bigHighId, bigLowId));
        sorted.sort(RankingEngine.ORDER);

        assertEquals(List.of(1, 2, 0), sorted.stream().map(RankedCluster::getClusterId).toList());
    }
}
