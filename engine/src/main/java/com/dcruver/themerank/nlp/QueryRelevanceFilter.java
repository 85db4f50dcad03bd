package com.dcruver.themerank.nlp;

import com.dcruver.themerank.config.PipelineProperties;
import com.dcruver.themerank.domain.EmbeddingVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Keeps documents whose cosine similarity to the embedded query reaches the
 * relevance threshold. Runs without a query pass every document through.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueryRelevanceFilter implements RelevanceFilter {

    private final CachedEmbeddingService embeddingService;
    private final PipelineProperties properties;

    @Override
    public List<Integer> filter(String queryText, List<EmbeddingVector> vectors) {
        if (queryText == null || queryText.isBlank()) {
            return IntStream.range(0, vectors.size()).boxed().toList();
        }

        EmbeddingVector query = embeddingService.embed(queryText);
        double threshold = properties.getRelevanceThreshold();

        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < vectors.size(); i++) {
            if (vectors.get(i).dimension() == query.dimension()
                && vectors.get(i).cosineSimilarity(query) >= threshold) {
                kept.add(i);
            }
        }

        log.info("Relevance filter kept {}/{} documents (threshold {})", kept.size(), vectors.size(), threshold);
        return kept;
    }
}
