package com.dcruver.themerank.cache;

import com.dcruver.themerank.domain.EmbeddingVector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressed key-value store for the exact and normalized tiers,
 * kept in SQLite. Entries are never evicted.
 *
 * Storage errors propagate as Spring DataAccessExceptions; the cache decides
 * how to degrade.
 */
@Component
@Slf4j
public class CacheTierStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CacheTierStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS embedding_cache (
                tier TEXT NOT NULL,
                content_hash TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                PRIMARY KEY (tier, content_hash)
            )
            """);

        log.info("Initialized embedding cache store");
    }

    /**
     * Retrieve the vector stored under a hash in one tier
     */
    public Optional<EmbeddingVector> get(CacheTier tier, String contentHash) {
        List<String> rows = jdbcTemplate.queryForList(
            "SELECT embedding_json FROM embedding_cache WHERE tier = ? AND content_hash = ?",
            String.class,
            tier.getKey(), contentHash
        );

        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(deserialize(rows.get(0)));
    }

    /**
     * Store (or overwrite) the vector under a hash in one tier
     */
    public void put(CacheTier tier, String contentHash, EmbeddingVector vector) {
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO embedding_cache (tier, content_hash, embedding_json, created_at) VALUES (?, ?, ?, ?)",
            tier.getKey(), contentHash, serialize(vector), Instant.now().getEpochSecond()
        );
        log.debug("Stored {} cache entry {}", tier.getKey(), contentHash);
    }

    public long count(CacheTier tier) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM embedding_cache WHERE tier = ?", Long.class, tier.getKey());
        return count != null ? count : 0L;
    }

    public void clear(CacheTier tier) {
        int removed = jdbcTemplate.update("DELETE FROM embedding_cache WHERE tier = ?", tier.getKey());
        log.info("Cleared {} {} cache entries", removed, tier.getKey());
    }

    private String serialize(EmbeddingVector vector) {
        try {
            return objectMapper.writeValueAsString(vector.toArray());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize embedding", e);
        }
    }

    private EmbeddingVector deserialize(String json) {
        try {
            return EmbeddingVector.of(objectMapper.readValue(json, float[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry", e);
        }
    }
}
