package com.dcruver.themerank.pipeline;

import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.domain.EmbeddingVector;
import com.dcruver.themerank.nlp.KeywordSet;
import com.dcruver.themerank.ranking.RankingResult;
import lombok.Data;

import java.util.List;

/**
 * Working state of one run, filled in stage by stage. Owned by the run's
 * single worker thread.
 */
@Data
public class RunContext {
    private final RunRequest request;
    private final String lockToken;

    private KeywordSet keywords;
    private List<Document> documents;
    private List<EmbeddingVector> vectors;
    private ClusterSummary clusters;
    private RankingResult ranking;

    public RunKey key() {
        return request.key();
    }
}
