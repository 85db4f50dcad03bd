package com.dcruver.themerank.pipeline;

import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.ranking.RankingResult;
import lombok.Value;

/**
 * How a run request ended. A conflicting request is an ordinary outcome, not an error.
 */
@Value
public class RunOutcome {

    public enum Kind {
        COMPLETED,
        FAILED,
        ALREADY_RUNNING
    }

    Kind kind;
    RunKey key;
    PipelineStage stage;  // stage reached; FAILED runs keep the stage they failed in
    String message;
    ClusterSummary clusters;
    RankingResult ranking;

    public static RunOutcome completed(RunKey key, ClusterSummary clusters, RankingResult ranking) {
        return new RunOutcome(Kind.COMPLETED, key, PipelineStage.COMPLETED,
            String.format("Ranked %d clusters", ranking.getRankings().size()), clusters, ranking);
    }

    public static RunOutcome failed(RunKey key, PipelineStage stage, String reason) {
        return new RunOutcome(Kind.FAILED, key, stage, reason, null, null);
    }

    public static RunOutcome alreadyRunning(RunKey key, PipelineStage stage) {
        return new RunOutcome(Kind.ALREADY_RUNNING, key, stage,
            "A run for " + key + " is already in progress", null, null);
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }
}
