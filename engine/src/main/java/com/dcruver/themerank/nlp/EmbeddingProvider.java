package com.dcruver.themerank.nlp;

import com.dcruver.themerank.domain.EmbeddingVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Source of text embeddings. Every vector from one provider has the same dimension.
 * Only {@link CachedEmbeddingService} calls it directly.
 */
public interface EmbeddingProvider {

    EmbeddingVector embed(String text);

    default List<EmbeddingVector> embedBatch(List<String> texts) {
        List<EmbeddingVector> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    String modelName();
}
