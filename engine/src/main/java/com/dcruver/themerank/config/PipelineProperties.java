package com.dcruver.themerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for run orchestration: worker pools, lock staleness and outputs.
 */
@ConfigurationProperties(prefix = "themerank.pipeline")
@Data
public class PipelineProperties {
    private int jobThreads = 4;
    private int computeThreads = 2;

    // A non-terminal lock without a heartbeat for this long is stale
    private Duration staleTimeout = Duration.ofMinutes(30);

    private double relevanceThreshold = 0.55;

    private String artifactsDir = System.getProperty("user.home") + "/.themerank/runs";
}
