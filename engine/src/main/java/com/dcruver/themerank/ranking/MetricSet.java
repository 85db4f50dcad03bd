package com.dcruver.themerank.ranking;

import lombok.Builder;
import lombok.Value;

/**
 * Per-cluster quality scores. Every component is on a 0-10 scale; the final
 * score is their weighted sum.
 */
@Value
@Builder
public class MetricSet {
    double coherence;
    double distinctiveness;
    double demand;
    double labelConfidence;
    double noiseScore;
    double painIntensity;
    double finalScore;
}
