package com.dcruver.themerank.cache;

import com.dcruver.themerank.domain.EmbeddingVector;

/**
 * Result of a cache lookup. A miss is an ordinary value telling the caller
 * to compute the embedding and register it.
 */
public sealed interface CacheLookup permits CacheLookup.Hit, CacheLookup.Miss {

    static CacheLookup hit(EmbeddingVector vector, CacheTier tier) {
        return new Hit(vector, tier);
    }

    static CacheLookup miss() {
        return Miss.INSTANCE;
    }

    default boolean isHit() {
        return this instanceof Hit;
    }

    record Hit(EmbeddingVector vector, CacheTier tier) implements CacheLookup {
    }

    record Miss() implements CacheLookup {
        private static final Miss INSTANCE = new Miss();
    }
}
