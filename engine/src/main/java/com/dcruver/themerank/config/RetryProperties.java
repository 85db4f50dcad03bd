package com.dcruver.themerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry policy for calls into external dependencies.
 */
@ConfigurationProperties(prefix = "themerank.retry")
@Data
public class RetryProperties {
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double multiplier = 2.0;
}
