package com.dcruver.themerank.app;

import com.dcruver.themerank.cache.CacheStatistics;
import com.dcruver.themerank.cache.CacheTier;
import com.dcruver.themerank.cache.SimilarityCache;
import com.dcruver.themerank.config.CacheProperties;
import com.dcruver.themerank.pipeline.JobStatus;
import com.dcruver.themerank.pipeline.JobStatusService;
import com.dcruver.themerank.pipeline.PipelineOrchestrator;
import com.dcruver.themerank.pipeline.RunLock;
import com.dcruver.themerank.pipeline.RunLockRegistry;
import com.dcruver.themerank.pipeline.RunOutcome;
import com.dcruver.themerank.pipeline.RunRequest;
import com.dcruver.themerank.reporting.RankingReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Spring Shell commands for the theme ranker.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class RankerShellCommands {

    private final PipelineOrchestrator orchestrator;
    private final RunLockRegistry lockRegistry;
    private final JobStatusService jobStatusService;
    private final SimilarityCache similarityCache;
    private final CacheProperties cacheProperties;
    private final RankingReportGenerator reportGenerator;

    @ShellMethod(key = "rank", value = "Run the ranking pipeline over a JSON file of posts")
    public String rank(
        @ShellOption(help = "Path to the posts JSON file") String source,
        @ShellOption(defaultValue = "local", help = "Owner of the run") String owner,
        @ShellOption(defaultValue = "default", help = "Job identifier") String job,
        @ShellOption(defaultValue = "", help = "Problem description used for relevance filtering") String query,
        @ShellOption(defaultValue = "", help = "Comma-separated communities to keep") String communities,
        @ShellOption(defaultValue = "false", help = "Return immediately instead of waiting") boolean background
    ) {
        log.info("Ranking request for {}/{} from {}", owner, job, source);

        try {
            List<String> communityList = communities.isBlank() ? List.of() :
                Arrays.stream(communities.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
            RunRequest request = new RunRequest(owner, job, query, source, communityList);

            var future = orchestrator.submit(request);
            if (background) {
                return String.format("Run %s/%s submitted. Use 'status --owner %s --job %s' to follow it.",
                    owner, job, owner, job);
            }

            return describe(future.join());

        } catch (Exception e) {
            log.error("Ranking failed", e);
            return "Ranking failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "status", value = "Show the status of a job")
    public String status(
        @ShellOption(defaultValue = "local") String owner,
        @ShellOption(defaultValue = "default") String job
    ) {
        try {
            Optional<JobStatus> status = jobStatusService.status(owner, job);
            if (status.isEmpty()) {
                return String.format("No job %s/%s found.", owner, job);
            }

            JobStatus s = status.get();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Job %s/%s\n\n", owner, job));
            sb.append(String.format("State: %s\n", s.getState()));
            sb.append(String.format("Stage: %s\n", s.getStage().getKey()));
            sb.append(String.format("Started: %s\n", s.getStartedAt()));
            sb.append(String.format("Updated: %s\n", s.getUpdatedAt()));
            if (s.getMessage() != null) {
                sb.append(String.format("Message: %s\n", s.getMessage()));
            }
            sb.append(String.format("Running: %s\n", lockRegistry.isRunning(owner, job) ? "yes" : "no"));

            orchestrator.lastOutcome(owner, job)
                .filter(RunOutcome::isCompleted)
                .ifPresent(outcome -> {
                    sb.append("\nClustering:\n");
                    sb.append(reportGenerator.clusteringSummary(outcome.getClusters()));
                    sb.append("\nRanking:\n");
                    sb.append(reportGenerator.rankingTable(outcome.getRanking(), RankingReportGenerator.DEFAULT_TOP));
                });

            return sb.toString();

        } catch (Exception e) {
            log.error("Status check failed", e);
            return "Failed to get status: " + e.getMessage();
        }
    }

    @ShellMethod(key = "runs", value = "List active runs")
    public String runs() {
        try {
            List<RunLock> active = lockRegistry.activeRuns();
            if (active.isEmpty()) {
                return "No active runs.";
            }

            Instant now = lockRegistry.now();
            StringBuilder sb = new StringBuilder("Active Runs:\n\n");
            for (RunLock lock : active) {
                sb.append(String.format("%s\n", lock.getKey()));
                sb.append(String.format("  Stage: %s\n", lock.getStage().getKey()));
                sb.append(String.format("  Started: %s\n", lock.getAcquiredAt()));
                sb.append(String.format("  Duration: %ds\n", lock.age(now).toSeconds()));
                sb.append(String.format("  Last heartbeat: %s\n\n", lock.getLastHeartbeat()));
            }
            sb.append(String.format("Total: %d runs\n", active.size()));
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to list runs", e);
            return "Failed to list runs: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cache stats", value = "Show embedding cache statistics")
    public String cacheStats() {
        try {
            CacheStatistics stats = similarityCache.getStats();

            StringBuilder sb = new StringBuilder();
            sb.append("Embedding Cache Statistics\n\n");
            sb.append(String.format("Status: %s\n", stats.isEnabled() ? "Enabled" : "Disabled"));
            sb.append(String.format("Requests: %d\n", stats.getTotalRequests()));
            sb.append(String.format("- Exact hits: %d (%.1f%%)\n", stats.getExactHits(), stats.getExactHitRate() * 100));
            sb.append(String.format("- Normalized hits: %d (%.1f%%)\n",
                stats.getNormalizedHits(), stats.getNormalizedHitRate() * 100));
            sb.append(String.format("- Semantic hits: %d (%.1f%%)\n",
                stats.getSemanticHits(), stats.getSemanticHitRate() * 100));
            sb.append(String.format("- Misses: %d\n", stats.getMisses()));
            sb.append(String.format("- Overall hit rate: %.1f%%\n", stats.getHitRate() * 100));
            sb.append(String.format("Average lookup: %.3f ms\n", stats.getAverageLookupMillis()));
            sb.append(String.format("Semantic searches: %d\n", stats.getSemanticSearches()));
            sb.append(String.format("Errors: %d\n\n", stats.getErrors()));

            sb.append("Entries:\n");
            sb.append(String.format("- Exact: %d\n", stats.getExactEntries()));
            sb.append(String.format("- Normalized: %d\n", stats.getNormalizedEntries()));
            sb.append(String.format("- Semantic: %d / %d (%d evicted)\n\n",
                stats.getSemanticEntries(), stats.getSemanticCapacity(), stats.getEvictions()));

            sb.append(String.format("Cache location: %s\n", cacheProperties.getDirectory()));
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to get cache stats", e);
            return "Failed to get cache stats: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cache clear", value = "Clear one cache tier (exact, normalized, semantic) or all")
    public String cacheClear(@ShellOption(defaultValue = "all") String tier) {
        try {
            if ("all".equalsIgnoreCase(tier)) {
                similarityCache.clear(null);
                return "All cache tiers cleared.";
            }

            Optional<CacheTier> target = Arrays.stream(CacheTier.values())
                .filter(t -> t.getKey().equalsIgnoreCase(tier))
                .findFirst();
            if (target.isEmpty()) {
                return "Unknown cache tier: " + tier + " (expected exact, normalized, semantic or all)";
            }

            similarityCache.clear(target.get());
            return String.format("Cache tier '%s' cleared.", target.get().getKey());

        } catch (Exception e) {
            log.error("Failed to clear cache", e);
            return "Failed to clear cache: " + e.getMessage();
        }
    }

    private String describe(RunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        switch (outcome.getKind()) {
            case ALREADY_RUNNING -> sb.append(String.format("Run %s is already in progress (stage %s).\n",
                outcome.getKey(), outcome.getStage() != null ? outcome.getStage().getKey() : "unknown"));
            case FAILED -> sb.append(String.format("Run %s failed during %s: %s\n",
                outcome.getKey(), outcome.getStage().getKey(), outcome.getMessage()));
            case COMPLETED -> {
                sb.append(String.format("Run %s completed.\n\n", outcome.getKey()));
                sb.append("Clustering:\n");
                sb.append(reportGenerator.clusteringSummary(outcome.getClusters()));
                sb.append("\nRanking:\n");
                sb.append(reportGenerator.rankingTable(outcome.getRanking(), RankingReportGenerator.DEFAULT_TOP));
            }
        }
        return sb.toString();
    }
}
