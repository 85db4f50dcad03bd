package com.dcruver.themerank.nlp;

import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.domain.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding provider backed by Ollama via Spring AI.
 * Calls go through the shared retry policy; exhausted retries surface as
 * {@link EmbeddingException}.
 */
@Service
@Slf4j
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final RetryPolicy retryPolicy;
    private final String modelName;
    private final int batchSize;

    public OllamaEmbeddingProvider(
        EmbeddingModel embeddingModel,
        RetryPolicy retryPolicy,
        @Value("${spring.ai.ollama.embedding.options.model:mxbai-embed-large:latest}") String modelName,
        @Value("${themerank.embedding.batch-size:32}") int batchSize
    ) {
        this.embeddingModel = embeddingModel;
        this.retryPolicy = retryPolicy;
        this.modelName = modelName;
        this.batchSize = Math.max(1, batchSize);
        log.info("OllamaEmbeddingProvider initialized with EmbeddingModel: {}", embeddingModel.getClass().getSimpleName());
    }

    /**
     * Generate embedding for a single text
     */
    @Override
    public EmbeddingVector embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot generate embedding for empty text");
        }

        try {
            float[] output = retryPolicy.execute("embedding", () -> embeddingModel.embed(text));
            if (output == null || output.length == 0) {
                throw new EmbeddingException("No embedding generated for text");
            }
            return EmbeddingVector.of(output);
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Failed to generate embedding: " + e.getMessage(), e);
        }
    }

    /**
     * Generate embeddings for multiple texts, in provider-sized batches
     */
    @Override
    public List<EmbeddingVector> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        List<EmbeddingVector> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            try {
                List<float[]> outputs = retryPolicy.execute("embedding-batch", () -> embeddingModel.embed(batch));
                if (outputs.size() != batch.size()) {
                    throw new EmbeddingException(String.format(
                        "Provider returned %d embeddings for %d texts", outputs.size(), batch.size()));
                }
                for (float[] output : outputs) {
                    vectors.add(EmbeddingVector.of(output));
                }
            } catch (EmbeddingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EmbeddingException("Failed to generate batch embeddings: " + e.getMessage(), e);
            }
            log.debug("Embedded batch {}-{} of {}", start, start + batch.size(), texts.size());
        }
        return vectors;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
