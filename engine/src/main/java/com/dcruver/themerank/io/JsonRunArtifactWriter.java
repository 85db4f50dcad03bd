package com.dcruver.themerank.io;

import com.dcruver.themerank.cluster.Cluster;
import com.dcruver.themerank.cluster.ClusterSummary;
import com.dcruver.themerank.config.PipelineProperties;
import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.pipeline.RunKey;
import com.dcruver.themerank.ranking.MetricSet;
import com.dcruver.themerank.ranking.RankedCluster;
import com.dcruver.themerank.ranking.RankingResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code cluster_summary.json} and {@code ranked_clusters.json} under
 * {@code <artifacts-dir>/<owner>/<job>/}, replacing earlier results for the
 * same job.
 */
@Component
@Slf4j
public class JsonRunArtifactWriter implements RunArtifactSink {

    static final String CLUSTER_SUMMARY_FILE = "cluster_summary.json";
    static final String RANKED_CLUSTERS_FILE = "ranked_clusters.json";

    private final PipelineProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public JsonRunArtifactWriter(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public void write(RunKey key, List<Document> documents, ClusterSummary clusters, RankingResult ranking)
        throws IOException {
        Path runDir = runDirectory(key);
        Files.createDirectories(runDir);

        ClusterSummaryRecord summary = new ClusterSummaryRecord(
            clusters.getClusters().stream().map(cluster -> toRecord(cluster, documents)).toList(),
            clusters.getStatistics(),
            clusters.getMetadata());
        objectMapper.writerWithDefaultPrettyPrinter()
            .writeValue(runDir.resolve(CLUSTER_SUMMARY_FILE).toFile(), summary);

        RankingRecord ranked = new RankingRecord(
            ranking.getRankings().stream().map(entry -> toRecord(entry, documents)).toList(),
            ranking.getMetadata());
        objectMapper.writerWithDefaultPrettyPrinter()
            .writeValue(runDir.resolve(RANKED_CLUSTERS_FILE).toFile(), ranked);

        log.info("Wrote run artifacts for {} to {}", key, runDir);
    }

    public Path runDirectory(RunKey key) {
        return Path.of(properties.getArtifactsDir()).resolve(key.owner()).resolve(key.job());
    }

    private ClusterRecord toRecord(Cluster cluster, List<Document> documents) {
        return new ClusterRecord(
            cluster.getId(),
            cluster.getLabel(),
            cluster.size(),
            cluster.getPercentage(),
            memberIds(cluster, documents),
            centroid(cluster),
            cluster.getSampleTexts());
    }

    private RankedRecord toRecord(RankedCluster ranked, List<Document> documents) {
        MetricSet m = ranked.getMetrics();
        return new RankedRecord(
            ranked.getRank(),
            ranked.getClusterId(),
            ranked.getCluster().getLabel(),
            ranked.size(),
            memberIds(ranked.getCluster(), documents),
            centroid(ranked.getCluster()),
            metrics(m),
            m.getFinalScore());
    }

    private static List<String> memberIds(Cluster cluster, List<Document> documents) {
        return cluster.getMemberIndices().stream()
            .map(index -> documents.get(index).getId())
            .toList();
    }

    private static List<Float> centroid(Cluster cluster) {
        if (cluster.getCentroid() == null) {
            return List.of();
        }
        float[] values = cluster.getCentroid().toArray();
        List<Float> centroid = new ArrayList<>(values.length);
        for (float value : values) {
            centroid.add(value);
        }
        return centroid;
    }

    private static Map<String, Double> metrics(MetricSet m) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("coherence", m.getCoherence());
        metrics.put("distinctiveness", m.getDistinctiveness());
        metrics.put("demand", m.getDemand());
        metrics.put("label_confidence", m.getLabelConfidence());
        metrics.put("noise_score", m.getNoiseScore());
        metrics.put("pain_intensity", m.getPainIntensity());
        return metrics;
    }

    record ClusterSummaryRecord(List<ClusterRecord> clusters, ClusterSummary.Statistics statistics,
                                ClusterSummary.Metadata metadata) {
    }

    record ClusterRecord(int clusterId, String label, int size, double percentage,
                         List<String> memberIds, List<Float> centroid, List<String> sampleTexts) {
    }

    record RankingRecord(List<RankedRecord> rankings, RankingResult.Metadata metadata) {
    }

    record RankedRecord(int rank, int clusterId, String label, int size, List<String> memberIds,
                        List<Float> centroid, Map<String, Double> metrics, double finalScore) {
    }
}
