package com.dcruver.themerank;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Theme Ranker.
 *
 * Embeds a batch of short posts through a tiered similarity cache, groups
 * them into density-based clusters and ranks each cluster on coherence,
 * distinctiveness, demand, label confidence and cleanliness.
 *
 * Runs are keyed by (owner, job) and guarded by a stage-tracking lock so a
 * job is never processed twice at the same time.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Slf4j
public class ThemeRankApplication {

    public static void main(String[] args) {
        log.info("Starting Theme Ranker...");
        SpringApplication.run(ThemeRankApplication.class, args);
    }
}
