package com.dcruver.themerank.nlp;

import com.dcruver.themerank.pipeline.RunRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives keywords from the run's free-text query: its content terms become
 * domain anchors, each paired with a few complaint templates.
 */
@Component
@Slf4j
public class QueryKeywordGenerator implements KeywordGenerator {

    private static final int MAX_ANCHORS = 8;
    private static final List<String> COMPLAINT_TEMPLATES = List.of("%s problem", "%s issue", "hate %s");

    @Override
    public KeywordSet generate(RunRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            log.info("No query for run {}, skipping keyword generation", request.key());
            return new KeywordSet(List.of(), List.of(), request.communities());
        }

        List<String> anchors = TermExtractor.terms(request.query()).stream()
            .distinct()
            .limit(MAX_ANCHORS)
            .toList();

        List<String> phrases = new ArrayList<>();
        for (String anchor : anchors) {
            for (String template : COMPLAINT_TEMPLATES) {
                phrases.add(String.format(template, anchor));
            }
        }

        log.info("Generated {} anchors and {} problem phrases for run {}", anchors.size(), phrases.size(), request.key());
        return new KeywordSet(anchors, phrases, request.communities());
    }
}
