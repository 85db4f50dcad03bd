package com.dcruver.themerank.nlp;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordThemeLabelerTest {

    private final KeywordThemeLabeler labeler = new KeywordThemeLabeler();

    @Test
    void testLabelUsesMostFrequentTerms() {
        String label = labeler.label(List.of(
            "Sync keeps failing on Android",
            "sync failing again after update",
            "Android sync is broken"));

        assertEquals("Sync failing android", label);
    }

    @Test
    void testLabelFallbackWhenNoContentTerms() {
        assertEquals("Untitled theme", labeler.label(List.of("it is so", "a b c")));
    }
}
