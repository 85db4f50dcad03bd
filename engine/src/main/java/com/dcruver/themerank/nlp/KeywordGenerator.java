package com.dcruver.themerank.nlp;

import com.dcruver.themerank.pipeline.RunRequest;

/**
 * Produces the search keywords for a run.
 */
public interface KeywordGenerator {

    KeywordSet generate(RunRequest request);
}
