package com.dcruver.themerank.io;

import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.nlp.KeywordSet;
import com.dcruver.themerank.pipeline.RunRequest;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the posts for a run.
 */
public interface DocumentSource {

    List<Document> fetch(RunRequest request, KeywordSet keywords) throws IOException;
}
