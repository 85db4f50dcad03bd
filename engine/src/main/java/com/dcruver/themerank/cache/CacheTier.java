package com.dcruver.themerank.cache;

/**
 * Lookup tiers, tried in declaration order.
 */
public enum CacheTier {
    EXACT("exact"),
    NORMALIZED("normalized"),
    SEMANTIC("semantic");

    private final String key;

    CacheTier(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
