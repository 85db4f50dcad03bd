package com.dcruver.themerank.nlp;

import com.dcruver.themerank.pipeline.RunRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryKeywordGeneratorTest {

    private final QueryKeywordGenerator generator = new QueryKeywordGenerator();

    @Test
    void testAnchorsComeFromQueryTerms() {
        RunRequest request = new RunRequest("u1", "j1", "Why does the invoice export keep failing?", "posts.json",
            List.of("accounting"));

        KeywordSet keywords = generator.generate(request);

        assertEquals(List.of("invoice", "export", "keep", "failing"), keywords.domainAnchors());
        assertEquals(12, keywords.problemPhrases().size());
        assertTrue(keywords.problemPhrases().contains("invoice problem"));
        assertTrue(keywords.problemPhrases().contains("hate export"));
        assertEquals(List.of("accounting"), keywords.communities());
    }

    @Test
    void testBlankQueryKeepsCommunitiesOnly() {
        KeywordSet keywords = generator.generate(new RunRequest("u1", "j1", " ", "posts.json", List.of("saas")));

        assertTrue(keywords.isEmpty());
        assertEquals(List.of("saas"), keywords.communities());
    }
}
