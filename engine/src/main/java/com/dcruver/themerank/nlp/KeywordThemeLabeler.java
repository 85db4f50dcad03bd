package com.dcruver.themerank.nlp;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Titles a cluster with its most frequent content terms.
 */
@Component
public class KeywordThemeLabeler implements ThemeLabeler {

    private static final int LABEL_TERMS = 3;

    @Override
    public String label(List<String> memberTexts) {
        List<String> top = TermExtractor.topTerms(memberTexts, LABEL_TERMS);
        if (top.isEmpty()) {
            return "Untitled theme";
        }
        String joined = String.join(" ", top);
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1);
    }
}
