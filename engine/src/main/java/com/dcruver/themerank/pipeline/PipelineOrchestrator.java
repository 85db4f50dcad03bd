package com.dcruver.themerank.pipeline;

import com.dcruver.themerank.cluster.Cluster;
import com.dcruver.themerank.cluster.ClusterBuilder;
import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.config.ExecutorConfiguration;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.StageResult;
import com.dcruver.themerank.io.DocumentSource;
import com.dcruver.themerank.io.RunArtifactSink;
import com.dcruver.themerank.nlp.CachedEmbeddingService;
import com.dcruver.themerank.nlp.EmbeddingException;
import com.dcruver.themerank.nlp.KeywordGenerator;
import com.dcruver.themerank.nlp.RelevanceFilter;
import com.dcruver.themerank.nlp.ThemeLabeler;
import com.dcruver.themerank.ranking.RankingEngine;
import com.dcruver.themerank.ranking.RankingResult;
import com.dcruver.themerank.reporting.RankingReportGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the ranking pipeline for one (owner, job) at a time.
 *
 * {@link #submit} claims the run lock synchronously, so a second request for
 * the same key gets {@link RunOutcome.Kind#ALREADY_RUNNING} straight away.
 * The stages then run in order on the job executor, with clustering and
 * ranking handed to the compute executor. Every stage yields a
 * {@link StageResult}; the first failure, or any exception escaping a stage,
 * ends the run as FAILED. The lock is always released, unless a newer run has
 * taken it over after this one went stale.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    static final List<PipelineStage> WORK_STAGES = List.of(
        PipelineStage.KEYWORD_GENERATION,
        PipelineStage.POSTS_FETCHING,
        PipelineStage.EMBEDDING_GENERATION,
        PipelineStage.SEMANTIC_FILTERING,
        PipelineStage.CLUSTERING,
        PipelineStage.PAIN_POINTS_EXTRACTION,
        PipelineStage.RANKING
    );

    private final RunLockRegistry lockRegistry;
    private final JobStatusService jobStatusService;
    private final KeywordGenerator keywordGenerator;
    private final DocumentSource documentSource;
    private final CachedEmbeddingService embeddingService;
    private final RelevanceFilter relevanceFilter;
    private final ClusterBuilder clusterBuilder;
    private final ThemeLabeler themeLabeler;
    private final RankingEngine rankingEngine;
    private final RunArtifactSink artifactSink;
    private final RankingReportGenerator reportGenerator;
    private final Executor jobExecutor;
    private final Executor computeExecutor;

    private final Map<RunKey, RunOutcome> lastOutcomes = new ConcurrentHashMap<>();

    public PipelineOrchestrator(RunLockRegistry lockRegistry,
                                JobStatusService jobStatusService,
                                KeywordGenerator keywordGenerator,
                                DocumentSource documentSource,
                                CachedEmbeddingService embeddingService,
                                RelevanceFilter relevanceFilter,
                                ClusterBuilder clusterBuilder,
                                ThemeLabeler themeLabeler,
                                RankingEngine rankingEngine,
                                RunArtifactSink artifactSink,
                                RankingReportGenerator reportGenerator,
                                @Qualifier(ExecutorConfiguration.JOB_EXECUTOR) Executor jobExecutor,
                                @Qualifier(ExecutorConfiguration.COMPUTE_EXECUTOR) Executor computeExecutor) {
        this.lockRegistry = lockRegistry;
        this.jobStatusService = jobStatusService;
        this.keywordGenerator = keywordGenerator;
        this.documentSource = documentSource;
        this.embeddingService = embeddingService;
        this.relevanceFilter = relevanceFilter;
        this.clusterBuilder = clusterBuilder;
        this.themeLabeler = themeLabeler;
        this.rankingEngine = rankingEngine;
        this.artifactSink = artifactSink;
        this.reportGenerator = reportGenerator;
        this.jobExecutor = jobExecutor;
        this.computeExecutor = computeExecutor;
    }

    /**
     * Start a run in the background. Completes with ALREADY_RUNNING without
     * doing any work when the key is held by a live run.
     */
    public CompletableFuture<RunOutcome> submit(RunRequest request) {
        RunKey key = request.key();
        Optional<String> token = lockRegistry.acquire(key.owner(), key.job());
        if (token.isEmpty()) {
            PipelineStage stage = lockRegistry.currentStage(key.owner(), key.job()).orElse(null);
            log.info("Run {} is already in progress (stage {}), ignoring request", key, stage);
            return CompletableFuture.completedFuture(RunOutcome.alreadyRunning(key, stage));
        }

        RunContext context = new RunContext(request, token.get());
        jobStatusService.started(key);
        try {
            return CompletableFuture.supplyAsync(() -> execute(context), jobExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule run {}: {}", key, e.getMessage());
            return CompletableFuture.completedFuture(
                fail(context, PipelineStage.KEYWORD_GENERATION, "Run could not be scheduled: " + e.getMessage()));
        }
    }

    public Optional<RunOutcome> lastOutcome(String owner, String job) {
        return Optional.ofNullable(lastOutcomes.get(new RunKey(owner, job)));
    }

    RunOutcome execute(RunContext context) {
        RunKey key = context.key();
        PipelineStage stage = PipelineStage.KEYWORD_GENERATION;

        log.info("Starting run {}", key);
        try {
            for (PipelineStage next : WORK_STAGES) {
                stage = next;
                if (!lockRegistry.updateStage(key.owner(), key.job(), context.getLockToken(), stage)) {
                    return abandon(key, stage);
                }
                jobStatusService.stageChanged(key, stage);

                StageResult<Void> result = runStage(stage, context);
                if (result instanceof StageResult.Failure<Void> failure) {
                    return fail(context, stage, failure.reason());
                }
                lockRegistry.heartbeat(key.owner(), key.job(), context.getLockToken());
            }
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Run {} failed unexpectedly in stage {}", key, stage, cause);
            return fail(context, stage, "Unexpected error in " + stage.getKey() + ": " + cause.getMessage());
        }

        return complete(context);
    }

    private StageResult<Void> runStage(PipelineStage stage, RunContext context) {
        return switch (stage) {
            case KEYWORD_GENERATION -> generateKeywords(context);
            case POSTS_FETCHING -> fetchPosts(context);
            case EMBEDDING_GENERATION -> generateEmbeddings(context);
            case SEMANTIC_FILTERING -> filterRelevant(context);
            case CLUSTERING -> cluster(context);
            case PAIN_POINTS_EXTRACTION -> extractThemes(context);
            case RANKING -> rank(context);
            default -> StageResult.failure("Stage " + stage + " has no work");
        };
    }

    private StageResult<Void> generateKeywords(RunContext context) {
        context.setKeywords(keywordGenerator.generate(context.getRequest()));
        return StageResult.success(null);
    }

    private StageResult<Void> fetchPosts(RunContext context) {
        List<Document> documents;
        try {
            documents = documentSource.fetch(context.getRequest(), context.getKeywords());
        } catch (IOException e) {
            log.error("Fetching posts for {} failed: {}", context.key(), e.getMessage());
            return StageResult.failure("Could not fetch posts: " + e.getMessage());
        }

        List<Document> valid = documents.stream().filter(Document::isValid).toList();
        if (valid.isEmpty()) {
            return StageResult.failure("No posts found for run");
        }
        context.setDocuments(valid);
        log.info("Fetched {} posts for {}", valid.size(), context.key());
        return StageResult.success(null);
    }

    private StageResult<Void> generateEmbeddings(RunContext context) {
        List<String> texts = context.getDocuments().stream().map(Document::getText).toList();
        try {
            context.setVectors(embeddingService.embedAll(texts));
        } catch (EmbeddingException e) {
            log.error("Embedding generation for {} failed: {}", context.key(), e.getMessage());
            return StageResult.failure("Embedding generation failed: " + e.getMessage());
        }
        return StageResult.success(null);
    }

    private StageResult<Void> filterRelevant(RunContext context) {
        String query = context.getRequest().hasQuery() ? context.getRequest().query() : "";
        List<Integer> kept;
        try {
            kept = relevanceFilter.filter(query, context.getVectors());
        } catch (EmbeddingException e) {
            return StageResult.failure("Relevance filtering failed: " + e.getMessage());
        }

        if (kept.isEmpty()) {
            return StageResult.failure("No posts passed relevance filtering");
        }

        List<Document> documents = new ArrayList<>(kept.size());
        List<EmbeddingVector> vectors = new ArrayList<>(kept.size());
        for (int index : kept) {
            documents.add(context.getDocuments().get(index));
            vectors.add(context.getVectors().get(index));
        }
        context.setDocuments(List.copyOf(documents));
        context.setVectors(List.copyOf(vectors));
        return StageResult.success(null);
    }

    private StageResult<Void> cluster(RunContext context) {
        StageResult<ClusterSummary> result = onComputePool(
            () -> clusterBuilder.build(context.getDocuments(), context.getVectors()));
        if (result instanceof StageResult.Success<ClusterSummary> success) {
            context.setClusters(success.value());
        }
        return result.map(summary -> null);
    }

    private StageResult<Void> extractThemes(RunContext context) {
        List<Cluster> labelled = new ArrayList<>();
        for (Cluster cluster : context.getClusters().getClusters()) {
            List<String> texts = cluster.getMemberIndices().stream()
                .map(index -> context.getDocuments().get(index).getText())
                .toList();
            String label = themeLabeler.label(texts);
            labelled.add(cluster.withLabel(label).withLabelVector(embedLabel(context.key(), label)));
        }
        context.setClusters(context.getClusters().withClusters(labelled));
        log.info("Labelled {} clusters for {}", labelled.size(), context.key());
        return StageResult.success(null);
    }

    private EmbeddingVector embedLabel(RunKey key, String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        try {
            return embeddingService.embedExact(label);
        } catch (EmbeddingException e) {
            log.warn("Could not embed label '{}' for {}: {}", label, key, e.getMessage());
            return null;
        }
    }

    private StageResult<Void> rank(RunContext context) {
        StageResult<RankingResult> result = onComputePool(() -> rankingEngine.rank(
            context.getClusters().getClusters(), context.getDocuments(), context.getVectors()));
        if (result instanceof StageResult.Success<RankingResult> success) {
            context.setRanking(success.value());
        }
        return result.map(ranking -> null);
    }

    private <T> StageResult<T> onComputePool(Supplier<StageResult<T>> work) {
        return CompletableFuture.supplyAsync(work, computeExecutor).join();
    }

    private RunOutcome complete(RunContext context) {
        RunKey key = context.key();
        try {
            artifactSink.write(key, context.getDocuments(), context.getClusters(), context.getRanking());
        } catch (IOException e) {
            log.error("Writing artifacts for {} failed: {}", key, e.getMessage());
            return fail(context, PipelineStage.RANKING, "Could not write run artifacts: " + e.getMessage());
        }

        reportGenerator.logRankingTable(context.getRanking());

        String token = context.getLockToken();
        if (!lockRegistry.updateStage(key.owner(), key.job(), token, PipelineStage.COMPLETED)) {
            return abandon(key, PipelineStage.RANKING);
        }
        RunOutcome outcome = RunOutcome.completed(key, context.getClusters(), context.getRanking());
        jobStatusService.completed(key, outcome.getMessage());
        lockRegistry.release(key.owner(), key.job(), token, true);
        lastOutcomes.put(key, outcome);
        log.info("Run {} completed: {}", key, outcome.getMessage());
        return outcome;
    }

    private RunOutcome fail(RunContext context, PipelineStage stage, String reason) {
        RunKey key = context.key();
        String token = context.getLockToken();
        log.error("Run {} failed at {}: {}", key, stage, reason);
        if (!lockRegistry.updateStage(key.owner(), key.job(), token, PipelineStage.FAILED)) {
            return abandon(key, stage);
        }
        jobStatusService.failed(key, reason);
        lockRegistry.release(key.owner(), key.job(), token, false);
        RunOutcome outcome = RunOutcome.failed(key, stage, reason);
        lastOutcomes.put(key, outcome);
        return outcome;
    }

    /**
     * The lock was taken over after this run went stale. The job status and
     * the lock now belong to the newer run and are left alone.
     */
    private RunOutcome abandon(RunKey key, PipelineStage stage) {
        log.warn("Run {} lost its lock during {}; stopping without touching the newer run", key, stage);
        return RunOutcome.failed(key, stage, "Run lock was taken over by a newer run");
    }
}
