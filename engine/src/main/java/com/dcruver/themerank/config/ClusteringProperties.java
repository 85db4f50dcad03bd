package com.dcruver.themerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for dimensionality reduction and density clustering.
 * Effective values shrink with the corpus size; these are the upper bounds.
 */
@ConfigurationProperties(prefix = "themerank.clustering")
@Data
public class ClusteringProperties {
    private int minDocuments = 3;

    private int minClusterSize = 10;
    private int minSamples = 2;
    private boolean allowSingleCluster = true;

    // Below this many documents PCA replaces UMAP
    private int pcaThreshold = 15;
    private int pcaMaxComponents = 5;

    private int umapNeighbors = 15;
    private int umapNeighborsCap = 5;
    private int umapComponents = 20;
    private int umapComponentsCap = 10;
    private double umapMinDist = 0.1;
    private int umapEpochs = 0;  // 0 = derive from corpus size
    private long randomSeed = 42L;

    private int sampleSize = 15;
}
