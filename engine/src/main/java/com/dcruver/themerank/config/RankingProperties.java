package com.dcruver.themerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Metric weights and noise-detection parameters for cluster ranking.
 * The four primary weights are expected to sum to 1.0; pain intensity is
 * added on top.
 */
@ConfigurationProperties(prefix = "themerank.ranking")
@Data
public class RankingProperties {
    private double coherenceWeight = 0.35;
    private double distinctivenessWeight = 0.25;
    private double demandWeight = 0.25;
    private double labelConfidenceWeight = 0.15;

    private boolean includePainIntensity = true;
    private double painWeight = 0.05;

    // k-distance eps estimation for the DBSCAN re-pass
    private int kForEps = 5;
    private double epsPercentile = 10.0;
    private double defaultEps = 0.35;
    private int dbscanMinSamples = 2;

    // LOF fallback
    private int lofNeighbors = 20;
    private double lofOutlierPercentile = 20.0;

    private List<String> painLexicon = List.of(
        "problem", "issue", "error", "fail", "failed", "sue", "sued", "expensive", "broken",
        "hard", "difficult", "lost", "complain", "complaint", "frustrat", "annoy", "angry",
        "hate", "can't", "cant", "doesn't", "doesnt", "bug", "worst", "terrible", "awful",
        "suck", "sucks", "useless", "waste", "slow", "crash", "freeze", "stuck"
    );

    public double primaryWeightSum() {
        return coherenceWeight + distinctivenessWeight + demandWeight + labelConfidenceWeight;
    }
}
