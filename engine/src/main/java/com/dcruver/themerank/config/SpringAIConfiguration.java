package com.dcruver.themerank.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Spring AI EmbeddingModel backing the embedding provider.
 *
 * Only embeddings are needed here; cluster titles come from the labeler,
 * not from a chat model.
 */
@Configuration
@Slf4j
public class SpringAIConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.embedding.options.model:mxbai-embed-large:latest}")
    private String embeddingModelName;

    /**
     * Create the Ollama API client
     */
    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    /**
     * Create the EmbeddingModel bean for Spring AI integration
     */
    @Bean
    public EmbeddingModel embeddingModel(
            OllamaApi ollamaApi,
            ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Creating EmbeddingModel with Ollama model: {}", embeddingModelName);

        var options = OllamaOptions.builder()
                .model(embeddingModelName)
                .build();

        // Model management - don't auto-pull models (they should already exist in Ollama)
        var managementOptions = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        return new OllamaEmbeddingModel(ollamaApi, options,
                observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP), managementOptions);
    }
}
