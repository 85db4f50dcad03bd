package com.dcruver.themerank.reporting;

import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.ranking.MetricSet;
import com.dcruver.themerank.ranking.RankedCluster;
import com.dcruver.themerank.ranking.RankingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Plain-text summaries of a finished run, for the log and the shell.
 */
@Component
@Slf4j
public class RankingReportGenerator {

    public static final int DEFAULT_TOP = 10;

    private static final int LABEL_WIDTH = 32;

    /**
     * Log the ranking table for the best clusters
     */
    public void logRankingTable(RankingResult ranking) {
        log.info("Top {} clusters:\n{}", Math.min(DEFAULT_TOP, ranking.getRankings().size()),
            rankingTable(ranking, DEFAULT_TOP));
    }

    public String rankingTable(RankingResult ranking, int top) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-4s %-6s %-" + LABEL_WIDTH + "s %5s %7s %7s %7s %7s %7s %7s %9s\n",
            "Rank", "ID", "Label", "Size", "Coher", "Dist", "Demand", "Label", "Noise", "Pain", "Final"));

        for (RankedCluster entry : ranking.top(top)) {
            MetricSet m = entry.getMetrics();
            sb.append(String.format("%-4d %-6d %-" + LABEL_WIDTH + "s %5d %7.2f %7.2f %7.2f %7.2f %7.2f %7.2f %9.4f\n",
                entry.getRank(),
                entry.getClusterId(),
                truncate(entry.getCluster().getLabel(), LABEL_WIDTH),
                entry.size(),
                m.getCoherence(),
                m.getDistinctiveness(),
                m.getDemand(),
                m.getLabelConfidence(),
                m.getNoiseScore(),
                m.getPainIntensity(),
                m.getFinalScore()));
        }
        return sb.toString();
    }

    public String clusteringSummary(ClusterSummary summary) {
        ClusterSummary.Statistics stats = summary.getStatistics();
        ClusterSummary.Metadata meta = summary.getMetadata();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("- Documents: %d\n", stats.getTotalDocuments()));
        sb.append(String.format("- Clustered: %d\n", stats.getClusteredDocuments()));
        sb.append(String.format("- Noise: %d\n", stats.getNoiseDocuments()));
        sb.append(String.format("- Clusters: %d\n", stats.getClusterCount()));
        sb.append(String.format("- Reducer: %s (%d components%s)\n", meta.getReducer(), meta.getComponents(),
            meta.getNeighbors() > 0 ? ", " + meta.getNeighbors() + " neighbours" : ""));
        sb.append(String.format("- Min cluster size: %d\n", meta.getMinClusterSize()));
        return sb.toString();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "-";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
