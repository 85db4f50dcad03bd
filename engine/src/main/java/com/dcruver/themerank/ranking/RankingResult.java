package com.dcruver.themerank.ranking;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ranked clusters, best first, plus the settings that produced them.
 */
@Value
@Builder
public class RankingResult {
    List<RankedCluster> rankings;
    Metadata metadata;

    public List<RankedCluster> top(int count) {
        return rankings.subList(0, Math.min(count, rankings.size()));
    }

    @Value
    @Builder
    public static class Metadata {
        Instant rankedAt;
        int totalClusters;
        Map<String, Double> weightsUsed;
        double painWeight;
        boolean painIncluded;
    }
}
