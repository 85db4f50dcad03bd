package com.dcruver.themerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the tiered similarity cache.
 */
@ConfigurationProperties(prefix = "themerank.cache")
@Data
public class CacheProperties {
    private boolean enabled = true;
    private String directory = System.getProperty("user.home") + "/.themerank/cache";

    // Minimum cosine similarity for a semantic-tier hit
    private double similarityThreshold = 0.87;

    // Fixed slot count of the semantic index
    private int maxSemanticEntries = 5000;

    private int excerptLength = 100;
}
