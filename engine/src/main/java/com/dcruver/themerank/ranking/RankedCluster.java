package com.dcruver.themerank.ranking;

import com.dcruver.themerank.cluster.Cluster;
import lombok.Value;

/**
 * A cluster with its scores and 1-based position in the ranking.
 */
@Value
public class RankedCluster {
    int rank;
    Cluster cluster;
    MetricSet metrics;

    public int getClusterId() {
        return cluster.getId();
    }

    public int size() {
        return cluster.size();
    }
}
