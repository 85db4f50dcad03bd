package com.dcruver.themerank.cache;

import com.dcruver.themerank.config.CacheProperties;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.nlp.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Three-tier embedding cache.
 *
 * Lookups try the exact content hash, then the hash of the normalized text,
 * then (when the caller supplies a probe vector) the nearest neighbour in the
 * semantic index. Normalized and semantic hits are written back to the
 * cheaper tiers so the next lookup for the same text is exact.
 *
 * The exact and normalized tiers live in SQLite and are never evicted. The
 * semantic index is bounded and is snapshotted to disk as JSON on shutdown.
 *
 * Storage failures never reach the caller: lookups degrade to a miss,
 * registrations to a logged no-op.
 */
@Component
@Slf4j
public class SimilarityCache {

    static final String SNAPSHOT_FILE = "semantic-index.json";

    private final CacheTierStore store;
    private final TextNormalizer normalizer;
    private final CacheProperties properties;
    private final ObjectMapper objectMapper;
    private final SemanticIndex semanticIndex;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong exactHits = new AtomicLong();
    private final AtomicLong normalizedHits = new AtomicLong();
    private final AtomicLong semanticHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong semanticSearches = new AtomicLong();
    private final AtomicLong lookupNanos = new AtomicLong();

    private Path snapshotFile;

    public SimilarityCache(CacheTierStore store, TextNormalizer normalizer,
                           CacheProperties properties, ObjectMapper objectMapper) {
        this.store = store;
        this.normalizer = normalizer;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.semanticIndex = new SemanticIndex(properties.getMaxSemanticEntries());
    }

    @PostConstruct
    public void init() {
        if (!properties.isEnabled()) {
            log.info("Similarity cache disabled");
            return;
        }

        try {
            Path cacheDir = Path.of(properties.getDirectory());
            Files.createDirectories(cacheDir);
            snapshotFile = cacheDir.resolve(SNAPSHOT_FILE);

            if (Files.exists(snapshotFile)) {
                int restored = loadSnapshot();
                log.info("Loaded semantic index snapshot with {} entries", restored);
            } else {
                log.info("No semantic index snapshot found, starting fresh");
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load semantic index snapshot: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!properties.isEnabled() || snapshotFile == null) {
            return;
        }
        try {
            List<SemanticIndex.Entry> entries = semanticIndex.entries();
            objectMapper.writeValue(snapshotFile.toFile(), entries);
            log.info("Saved semantic index snapshot with {} entries", entries.size());
        } catch (IOException e) {
            log.error("Failed to save semantic index snapshot: {}", e.getMessage(), e);
        }
    }

    /**
     * Exact and normalized tiers only
     */
    public CacheLookup lookup(String text) {
        return lookup(text, null);
    }

    /**
     * Full tiered lookup. The semantic tier is consulted only when a probe
     * vector is given.
     */
    public CacheLookup lookup(String text, EmbeddingVector probe) {
        if (!properties.isEnabled() || text == null) {
            return CacheLookup.miss();
        }

        long started = System.nanoTime();
        totalRequests.incrementAndGet();
        try {
            String exactHash = normalizer.contentHash(text);
            Optional<EmbeddingVector> exact = store.get(CacheTier.EXACT, exactHash);
            if (exact.isPresent()) {
                exactHits.incrementAndGet();
                log.debug("Exact cache hit {}", exactHash);
                return CacheLookup.hit(exact.get(), CacheTier.EXACT);
            }

            String normalizedHash = normalizer.normalizedHash(text);
            Optional<EmbeddingVector> normalized = store.get(CacheTier.NORMALIZED, normalizedHash);
            if (normalized.isPresent()) {
                normalizedHits.incrementAndGet();
                store.put(CacheTier.EXACT, exactHash, normalized.get());
                log.debug("Normalized cache hit {} -> back-filled {}", normalizedHash, exactHash);
                return CacheLookup.hit(normalized.get(), CacheTier.NORMALIZED);
            }

            if (probe != null) {
                semanticSearches.incrementAndGet();
                Optional<SemanticIndex.Match> match = semanticIndex.findBest(probe);
                if (match.isPresent() && match.get().similarity() >= properties.getSimilarityThreshold()) {
                    EmbeddingVector vector = match.get().vector();
                    semanticHits.incrementAndGet();
                    store.put(CacheTier.EXACT, exactHash, vector);
                    store.put(CacheTier.NORMALIZED, normalizedHash, vector);
                    log.debug("Semantic cache hit {} (similarity {})",
                        match.get().hash(), String.format("%.4f", match.get().similarity()));
                    return CacheLookup.hit(vector, CacheTier.SEMANTIC);
                }
            }

            misses.incrementAndGet();
            return CacheLookup.miss();
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("Cache lookup failed, treating as miss: {}", e.getMessage());
            return CacheLookup.miss();
        } finally {
            lookupNanos.addAndGet(System.nanoTime() - started);
        }
    }

    /**
     * Store a freshly computed embedding in all three tiers
     */
    public void register(String text, EmbeddingVector vector) {
        if (!properties.isEnabled() || text == null || vector == null) {
            return;
        }

        try {
            String exactHash = normalizer.contentHash(text);
            store.put(CacheTier.EXACT, exactHash, vector);
            store.put(CacheTier.NORMALIZED, normalizer.normalizedHash(text), vector);
            semanticIndex.add(exactHash, vector, excerpt(text));
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.warn("Cache registration failed, continuing without caching: {}", e.getMessage());
        }
    }

    /**
     * Store an embedding under the exact and normalized hashes only. The
     * semantic index is left untouched, so the vector can never be served to
     * a different text.
     */
    public void registerKeyed(String text, EmbeddingVector vector) {
        if (!properties.isEnabled() || text == null || vector == null) {
            return;
        }

        try {
            store.put(CacheTier.EXACT, normalizer.contentHash(text), vector);
            store.put(CacheTier.NORMALIZED, normalizer.normalizedHash(text), vector);
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.warn("Cache registration failed, continuing without caching: {}", e.getMessage());
        }
    }

    /**
     * Clear one tier, or all tiers when {@code tier} is null
     */
    public void clear(CacheTier tier) {
        List<CacheTier> tiers = tier == null ? Arrays.asList(CacheTier.values()) : List.of(tier);
        for (CacheTier target : tiers) {
            if (target == CacheTier.SEMANTIC) {
                semanticIndex.clear();
                log.info("Cleared semantic index");
            } else {
                try {
                    store.clear(target);
                } catch (RuntimeException e) {
                    log.warn("Failed to clear {} tier: {}", target.getKey(), e.getMessage());
                }
            }
        }
    }

    public CacheStatistics getStats() {
        CacheStatistics stats = new CacheStatistics();
        stats.setEnabled(properties.isEnabled());
        stats.setTotalRequests(totalRequests.get());
        stats.setExactHits(exactHits.get());
        stats.setNormalizedHits(normalizedHits.get());
        stats.setSemanticHits(semanticHits.get());
        stats.setMisses(misses.get());
        stats.setErrors(errors.get());
        stats.setSemanticSearches(semanticSearches.get());
        stats.setEvictions(semanticIndex.evictedTotal());
        stats.setSemanticEntries(semanticIndex.size());
        stats.setSemanticCapacity(semanticIndex.capacity());

        long requests = totalRequests.get();
        stats.setAverageLookupMillis(requests == 0 ? 0.0 : lookupNanos.get() / 1_000_000.0 / requests);

        try {
            stats.setExactEntries(store.count(CacheTier.EXACT));
            stats.setNormalizedEntries(store.count(CacheTier.NORMALIZED));
        } catch (RuntimeException e) {
            log.warn("Could not count cache entries: {}", e.getMessage());
        }
        return stats;
    }

    SemanticIndex semanticIndex() {
        return semanticIndex;
    }

    private String excerpt(String text) {
        int limit = Math.max(0, properties.getExcerptLength());
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private int loadSnapshot() throws IOException {
        SemanticIndex.Entry[] entries = objectMapper.readValue(snapshotFile.toFile(), SemanticIndex.Entry[].class);
        int restored = 0;
        for (SemanticIndex.Entry entry : entries) {
            if (entry.hash() == null || entry.vector() == null) {
                continue;
            }
            if (semanticIndex.add(entry.hash(), EmbeddingVector.of(entry.vector()), entry.excerpt())) {
                restored++;
            }
        }
        return restored;
    }
}
