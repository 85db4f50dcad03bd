package com.dcruver.themerank.io;

import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.pipeline.RunKey;
import com.dcruver.themerank.ranking.RankingResult;

import java.io.IOException;
import java.util.List;

/**
 * Receives the results of a finished run.
 */
public interface RunArtifactSink {

    void write(RunKey key, List<Document> documents, ClusterSummary clusters, RankingResult ranking) throws IOException;
}
