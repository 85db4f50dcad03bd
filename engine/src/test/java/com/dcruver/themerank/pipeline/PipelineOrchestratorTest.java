package com.dcruver.themerank.pipeline;

import com.dcruver.themerank.cluster.ClusterBuilder;
import com.dcruver.themerank.config.ClusteringProperties;
import com.dcruver.themerank.config.RankingProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.io.DocumentSource;
import com.dcruver.themerank.io.RunArtifactSink;
import com.dcruver.themerank.nlp.CachedEmbeddingService;
import com.dcruver.themerank.nlp.EmbeddingException;
import com.dcruver.themerank.nlp.KeywordGenerator;
import com.dcruver.themerank.nlp.KeywordSet;
import com.dcruver.themerank.nlp.RelevanceFilter;
import com.dcruver.themerank.nlp.ThemeLabeler;
import com.dcruver.themerank.ranking.NoiseDetector;
import com.dcruver.themerank.ranking.RankingEngine;
import com.dcruver.themerank.reporting.RankingReportGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for stage sequencing, run locking and failure handling.
 * Stages run on the calling thread.
 */
class PipelineOrchestratorTest {

    private static final EmbeddingVector CRASH = EmbeddingVector.of(new float[]{0.6f, 0.8f, 0f});
    private static final Executor DIRECT = Runnable::run;

    private MutableClock clock;
    private RunLockRegistry registry;
    private JobStatusService jobStatusService;
    private KeywordGenerator keywordGenerator;
    private DocumentSource documentSource;
    private CachedEmbeddingService embeddingService;
    private RelevanceFilter relevanceFilter;
    private ThemeLabeler themeLabeler;
    private RunArtifactSink artifactSink;
    private PipelineOrchestrator orchestrator;

    private final RunRequest request = new RunRequest("u1", "j1", "app crashes", "posts.json", List.of());

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new RunLockRegistry(Duration.ofMinutes(30), clock);
        jobStatusService = mock(JobStatusService.class);
        keywordGenerator = mock(KeywordGenerator.class);
        documentSource = mock(DocumentSource.class);
        embeddingService = mock(CachedEmbeddingService.class);
        relevanceFilter = mock(RelevanceFilter.class);
        themeLabeler = mock(ThemeLabeler.class);
        artifactSink = mock(RunArtifactSink.class);

        RankingProperties rankingProperties = new RankingProperties();
        RankingEngine rankingEngine = new RankingEngine(rankingProperties, new NoiseDetector(rankingProperties));

        orchestrator = new PipelineOrchestrator(registry, jobStatusService, keywordGenerator, documentSource,
            embeddingService, relevanceFilter, new ClusterBuilder(new ClusteringProperties()), themeLabeler,
            rankingEngine, artifactSink, new RankingReportGenerator(), DIRECT, DIRECT);

        when(keywordGenerator.generate(any())).thenReturn(KeywordSet.empty());
        when(themeLabeler.label(anyList())).thenReturn("App crashes");
        when(embeddingService.embedExact(anyString())).thenReturn(CRASH);
    }

    private static Document doc(String id, String text) {
        return Document.builder().id(id).text(text).build();
    }

    private void givenPosts(List<Document> posts) throws IOException {
        when(documentSource.fetch(any(), any())).thenReturn(posts);
        List<EmbeddingVector> vectors = posts.stream().map(p -> CRASH).toList();
        when(embeddingService.embedAll(anyList())).thenReturn(vectors);
        List<Integer> all = IntStream.range(0, posts.size()).boxed().toList();
        when(relevanceFilter.filter(anyString(), anyList())).thenReturn(all);
    }

    @Test
    void testSuccessfulRun() throws Exception {
        givenPosts(List.of(
            doc("p1", "the app crashes on startup"),
            doc("p2", "the app crashes on startup"),
            doc("p3", "the app crashes on startup")));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.COMPLETED, outcome.getKind());
        assertEquals(PipelineStage.COMPLETED, outcome.getStage());
        assertEquals(1, outcome.getClusters().clusterCount());
        assertEquals("App crashes", outcome.getRanking().getRankings().get(0).getCluster().getLabel());
        assertEquals(10.0, outcome.getRanking().getRankings().get(0).getMetrics().getLabelConfidence(), 1e-6);

        assertFalse(registry.isRunning("u1", "j1"));
        assertEquals(Boolean.TRUE, registry.lastResult("u1", "j1").orElseThrow());
        verify(artifactSink).write(eq(request.key()), anyList(), any(), any());
        verify(jobStatusService).started(request.key());
        verify(jobStatusService).completed(eq(request.key()), anyString());
        assertSame(outcome, orchestrator.lastOutcome("u1", "j1").orElseThrow());
        verify(embeddingService).embedExact("App crashes");
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void testLabelEmbeddingFailureOnlyZeroesLabelConfidence() throws Exception {
        givenPosts(List.of(
            doc("p1", "the app crashes on startup"),
            doc("p2", "the app crashes on startup"),
            doc("p3", "the app crashes on startup")));
        when(embeddingService.embedExact(anyString())).thenThrow(new EmbeddingException("model offline"));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.COMPLETED, outcome.getKind());
        assertEquals(0.0, outcome.getRanking().getRankings().get(0).getMetrics().getLabelConfidence(), 1e-9);
    }

    @Test
    void testRunThatLostItsLockLeavesNewerRunAlone() throws Exception {
        AtomicReference<String> takeover = new AtomicReference<>();
        when(documentSource.fetch(any(), any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(31));
            takeover.set(registry.acquire("u1", "j1").orElseThrow());
            registry.updateStage("u1", "j1", takeover.get(), PipelineStage.CLUSTERING);
            throw new IOException("posts.json not found");
        });

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("Run lock was taken over by a newer run", outcome.getMessage());
        assertTrue(registry.isRunning("u1", "j1"));
        assertEquals(PipelineStage.CLUSTERING, registry.currentStage("u1", "j1").orElseThrow());
        assertTrue(registry.lastResult("u1", "j1").isEmpty());
        verify(jobStatusService, never()).failed(any(), anyString());
        assertEquals(RunOutcome.Kind.ALREADY_RUNNING, orchestrator.submit(request).join().getKind());
    }

    @Test
    void testLockIsHeldWhileStagesRun() throws Exception {
        AtomicReference<PipelineStage> seen = new AtomicReference<>();
        when(documentSource.fetch(any(), any())).thenAnswer(invocation -> {
            seen.set(registry.currentStage("u1", "j1").orElse(null));
            assertTrue(registry.isRunning("u1", "j1"));
            return List.of(doc("p1", "only one post"));
        });
        when(embeddingService.embedAll(anyList())).thenReturn(List.of(CRASH));
        when(relevanceFilter.filter(anyString(), anyList())).thenReturn(List.of(0));

        orchestrator.submit(request).join();

        assertEquals(PipelineStage.POSTS_FETCHING, seen.get());
    }

    @Test
    void testSecondRequestWhileRunningIsRejected() throws Exception {
        String token = registry.acquire("u1", "j1").orElseThrow();
        registry.updateStage("u1", "j1", token, PipelineStage.CLUSTERING);

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.ALREADY_RUNNING, outcome.getKind());
        assertEquals(PipelineStage.CLUSTERING, outcome.getStage());
        verify(documentSource, never()).fetch(any(), any());
        verify(jobStatusService, never()).started(any());
        // the original holder keeps its lock
        assertTrue(registry.isRunning("u1", "j1"));
    }

    @Test
    void testTooFewPostsFailsAtClustering() throws Exception {
        givenPosts(List.of(doc("p1", "the app crashes"), doc("p2", "the app crashes")));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.FAILED, outcome.getKind());
        assertEquals(PipelineStage.CLUSTERING, outcome.getStage());
        assertTrue(outcome.getMessage().startsWith("Insufficient data for clustering"));
        assertFalse(registry.isRunning("u1", "j1"));
        assertEquals(Boolean.FALSE, registry.lastResult("u1", "j1").orElseThrow());
        verify(jobStatusService).failed(eq(request.key()), anyString());
        verify(artifactSink, never()).write(any(), any(), any(), any());
    }

    @Test
    void testFetchFailureEndsRun() throws Exception {
        when(documentSource.fetch(any(), any())).thenThrow(new IOException("posts.json not found"));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.FAILED, outcome.getKind());
        assertEquals(PipelineStage.POSTS_FETCHING, outcome.getStage());
        assertTrue(outcome.getMessage().contains("posts.json not found"));
        verify(embeddingService, never()).embedAll(anyList());
    }

    @Test
    void testUnexpectedExceptionIsReportedWithStage() {
        when(keywordGenerator.generate(any())).thenThrow(new IllegalStateException("boom"));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.FAILED, outcome.getKind());
        assertEquals(PipelineStage.KEYWORD_GENERATION, outcome.getStage());
        assertEquals("Unexpected error in keyword_generation: boom", outcome.getMessage());
        assertFalse(registry.isRunning("u1", "j1"));
    }

    @Test
    void testEmbeddingFailureEndsRun() throws Exception {
        when(documentSource.fetch(any(), any())).thenReturn(List.of(doc("p1", "crash")));
        when(embeddingService.embedAll(anyList())).thenThrow(new EmbeddingException("model offline"));

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(PipelineStage.EMBEDDING_GENERATION, outcome.getStage());
        assertTrue(outcome.getMessage().contains("model offline"));
    }

    @Test
    void testNothingRelevantEndsRun() throws Exception {
        givenPosts(List.of(doc("p1", "a"), doc("p2", "b"), doc("p3", "c")));
        when(relevanceFilter.filter(anyString(), anyList())).thenReturn(List.of());

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(PipelineStage.SEMANTIC_FILTERING, outcome.getStage());
        assertEquals("No posts passed relevance filtering", outcome.getMessage());
    }

    @Test
    void testArtifactFailureFailsRun() throws Exception {
        givenPosts(List.of(
            doc("p1", "the app crashes on startup"),
            doc("p2", "the app crashes on startup"),
            doc("p3", "the app crashes on startup")));
        doThrow(new IOException("disk full")).when(artifactSink).write(any(), any(), any(), any());

        RunOutcome outcome = orchestrator.submit(request).join();

        assertEquals(RunOutcome.Kind.FAILED, outcome.getKind());
        assertEquals(PipelineStage.RANKING, outcome.getStage());
        assertFalse(registry.isRunning("u1", "j1"));
    }

    @Test
    void testKeyCanBeReusedAfterFailure() throws Exception {
        when(documentSource.fetch(any(), any())).thenThrow(new IOException("offline"));
        orchestrator.submit(request).join();

        RunOutcome second = orchestrator.submit(request).join();

        assertNotEquals(RunOutcome.Kind.ALREADY_RUNNING, second.getKind());
    }
}
