package com.dcruver.themerank.cache;

import lombok.Data;

/**
 * Point-in-time view of cache activity since startup.
 */
@Data
public class CacheStatistics {
    private boolean enabled;

    private long totalRequests;
    private long exactHits;
    private long normalizedHits;
    private long semanticHits;
    private long misses;
    private long errors;

    private long semanticSearches;
    private long evictions;

    private long exactEntries;
    private long normalizedEntries;
    private int semanticEntries;
    private int semanticCapacity;

    private double averageLookupMillis;

    public long getTotalHits() {
        return exactHits + normalizedHits + semanticHits;
    }

    public double getHitRate() {
        return rate(getTotalHits());
    }

    public double getExactHitRate() {
        return rate(exactHits);
    }

    public double getNormalizedHitRate() {
        return rate(normalizedHits);
    }

    public double getSemanticHitRate() {
        return rate(semanticHits);
    }

    private double rate(long count) {
        return totalRequests == 0 ? 0.0 : (double) count / totalRequests;
    }
}
