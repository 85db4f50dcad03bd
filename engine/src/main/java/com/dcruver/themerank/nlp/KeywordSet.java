package com.dcruver.themerank.nlp;

import java.util.ArrayList;
import java.util.List;

/**
 * Search keywords for one run.
 *
 * @param domainAnchors  terms naming the problem domain
 * @param problemPhrases short phrases describing complaints in that domain
 * @param communities    source communities to prefer, may be empty
 */
public record KeywordSet(List<String> domainAnchors, List<String> problemPhrases, List<String> communities) {

    public KeywordSet {
        domainAnchors = List.copyOf(domainAnchors);
        problemPhrases = List.copyOf(problemPhrases);
        communities = List.copyOf(communities);
    }

    public static KeywordSet empty() {
        return new KeywordSet(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return domainAnchors.isEmpty() && problemPhrases.isEmpty();
    }

    /**
     * Anchors and phrases joined into a single probe text
     */
    public String asQueryText() {
        List<String> parts = new ArrayList<>(domainAnchors);
        parts.addAll(problemPhrases);
        return String.join(" ", parts);
    }
}
