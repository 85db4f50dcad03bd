package com.dcruver.themerank.pipeline;

/**
 * Steps of a ranking run, in execution order, plus the terminal FAILED.
 */
public enum PipelineStage {
    KEYWORD_GENERATION("keyword_generation"),
    POSTS_FETCHING("posts_fetching"),
    EMBEDDING_GENERATION("embedding_generation"),
    SEMANTIC_FILTERING("semantic_filtering"),
    CLUSTERING("clustering"),
    PAIN_POINTS_EXTRACTION("pain_points_extraction"),
    RANKING("ranking"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String key;

    PipelineStage(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
