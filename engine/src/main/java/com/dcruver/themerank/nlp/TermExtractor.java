package com.dcruver.themerank.nlp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits text into lower-case content terms (stopwords and short tokens removed).
 */
public final class TermExtractor {

    private static final int MIN_TERM_LENGTH = 3;

    private static final Set<String> STOPWORDS = Set.of(
        "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her", "was",
        "one", "our", "out", "has", "have", "this", "that", "with", "from", "they", "will", "would",
        "there", "their", "what", "about", "which", "when", "make", "like", "just", "than", "them",
        "been", "into", "some", "could", "other", "then", "these", "those", "also", "more", "very",
        "your", "only", "over", "such", "even", "most", "much", "really", "does", "did", "doing",
        "how", "why", "who", "get", "got", "its", "it's", "i'm", "don't", "dont", "am", "were",
        "being", "because", "should", "while", "where", "after", "before", "here", "again",
        "want", "need", "know", "think", "anyone", "someone", "something", "anything", "thing",
        "things", "use", "using", "used", "way", "still", "every", "each", "many", "well", "too"
    );

    private TermExtractor() {
    }

    public static List<String> terms(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+")) {
            String term = stripQuotes(token);
            if (term.length() >= MIN_TERM_LENGTH && !STOPWORDS.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    /**
     * Most frequent content terms across the texts, ties broken by first appearance.
     */
    public static List<String> topTerms(List<String> texts, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            for (String term : terms(text)) {
                counts.merge(term, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(limit)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private static String stripQuotes(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '\'') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '\'') {
            end--;
        }
        return token.substring(start, end);
    }
}
