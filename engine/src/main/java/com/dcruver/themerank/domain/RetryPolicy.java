package com.dcruver.themerank.domain;

import com.dcruver.themerank.config.RetryProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Single retry policy (bounded attempts, exponential backoff) for every call
 * into an external dependency. Each operation name gets its own Retry instance
 * so attempt counts and events stay separate.
 */
@Component
@Slf4j
public class RetryPolicy {

    private final RetryRegistry registry;

    public RetryPolicy(RetryProperties properties) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(Math.max(1, properties.getMaxAttempts()))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                properties.getInitialBackoff(), properties.getMultiplier()))
            .retryExceptions(RuntimeException.class)
            .build();

        this.registry = RetryRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(added ->
            added.getAddedEntry().getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}): {}",
                    event.getName(), event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown")));
    }

    /**
     * Run the call, retrying on runtime failures. The last failure is rethrown
     * once attempts are exhausted.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        Retry retry = registry.retry(operation);
        return Retry.decorateSupplier(retry, call).get();
    }
}
