package com.dcruver.themerank.cluster;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Output of one clustering pass.
 */
@Value
@Builder
public class ClusterSummary {
    List<Cluster> clusters;
    List<Integer> noiseIndices;
    Statistics statistics;
    Metadata metadata;

    public int clusterCount() {
        return clusters.size();
    }

    /**
     * Same summary with clusters replaced (e.g. after labelling)
     */
    public ClusterSummary withClusters(List<Cluster> replacement) {
        return new ClusterSummary(List.copyOf(replacement), noiseIndices, statistics, metadata);
    }

    @Value
    @Builder
    public static class Statistics {
        int totalDocuments;
        int clusteredDocuments;
        int noiseDocuments;
        int clusterCount;
    }

    @Value
    @Builder
    public static class Metadata {
        Instant createdAt;
        String reducer;
        int components;
        int neighbors;  // 0 when the reducer is PCA
        int minClusterSize;
        int minSamples;
        long randomSeed;
    }
}
