package com.dcruver.themerank.nlp;

import com.dcruver.themerank.domain.EmbeddingVector;

import java.util.List;

/**
 * Keeps the documents relevant to the run.
 */
public interface RelevanceFilter {

    /**
     * Indices (ascending) of the vectors to keep.
     *
     * @param queryText probe text for the run, blank when the run has none
     */
    List<Integer> filter(String queryText, List<EmbeddingVector> vectors);
}
