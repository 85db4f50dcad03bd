package com.dcruver.themerank.nlp;

import com.dcruver.themerank.cache.CacheLookup;
import com.dcruver.themerank.cache.SimilarityCache;
import com.dcruver.themerank.domain.EmbeddingVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Cache-fronted access to the embedding provider.
 *
 * Texts are first looked up in the exact and normalized tiers. The misses are
 * embedded in one batch; each fresh vector then probes the semantic tier, and a
 * close enough neighbour wins over the fresh vector so near-duplicate posts
 * share one embedding. Everything that stays a miss is registered.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CachedEmbeddingService {

    private final SimilarityCache cache;
    private final EmbeddingProvider provider;

    public EmbeddingVector embed(String text) {
        CacheLookup lookup = cache.lookup(text);
        if (lookup instanceof CacheLookup.Hit hit) {
            return hit.vector();
        }

        EmbeddingVector fresh = provider.embed(text);
        return resolveFresh(text, fresh);
    }

    /**
     * Embed a short generated text such as a theme label. Only the exact and
     * normalized tiers are consulted and written, so a label is never swapped
     * for the vector of a nearby post and never enters the post index.
     */
    public EmbeddingVector embedExact(String text) {
        CacheLookup lookup = cache.lookup(text);
        if (lookup instanceof CacheLookup.Hit hit) {
            return hit.vector();
        }

        EmbeddingVector fresh = provider.embed(text);
        cache.registerKeyed(text, fresh);
        return fresh;
    }

    /**
     * Embed every text, in input order.
     *
     * @throws EmbeddingException when the provider fails or returns vectors of
     *                            differing dimension
     */
    public List<EmbeddingVector> embedAll(List<String> texts) {
        EmbeddingVector[] results = new EmbeddingVector[texts.size()];
        List<Integer> missIndices = new ArrayList<>();
        List<String> missTexts = new ArrayList<>();

        for (int i = 0; i < texts.size(); i++) {
            CacheLookup lookup = cache.lookup(texts.get(i));
            if (lookup instanceof CacheLookup.Hit hit) {
                results[i] = hit.vector();
            } else {
                missIndices.add(i);
                missTexts.add(texts.get(i));
            }
        }

        log.info("Embedding {} texts: {} cached, {} to compute",
            texts.size(), texts.size() - missTexts.size(), missTexts.size());

        if (!missTexts.isEmpty()) {
            List<EmbeddingVector> fresh = provider.embedBatch(missTexts);
            for (int m = 0; m < missIndices.size(); m++) {
                results[missIndices.get(m)] = resolveFresh(missTexts.get(m), fresh.get(m));
            }
        }

        List<EmbeddingVector> vectors = List.of(results);
        requireSingleDimension(vectors);
        return vectors;
    }

    public String modelName() {
        return provider.modelName();
    }

    private EmbeddingVector resolveFresh(String text, EmbeddingVector fresh) {
        CacheLookup semantic = cache.lookup(text, fresh);
        if (semantic instanceof CacheLookup.Hit hit) {
            return hit.vector();
        }
        cache.register(text, fresh);
        return fresh;
    }

    private static void requireSingleDimension(List<EmbeddingVector> vectors) {
        if (vectors.isEmpty()) {
            return;
        }
        int dimension = vectors.get(0).dimension();
        for (EmbeddingVector vector : vectors) {
            if (vector.dimension() != dimension) {
                throw new EmbeddingException(String.format(
                    "Embedding dimension mismatch: expected %d, got %d", dimension, vector.dimension()));
            }
        }
    }
}
