package com.dcruver.themerank.cluster;

import com.dcruver.themerank.domain.EmbeddingVector;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;

/**
 * A group of documents found by density clustering.
 * Members are indices into the run's document list; documents are never copied.
 */
@Data
@Builder
@With
public class Cluster {
    private final int id;
    private final List<Integer> memberIndices;  // ascending
    private final EmbeddingVector centroid;  // unit mean of member embeddings
    private final double percentage;  // share of all documents, 2 decimals
    private final List<String> sampleTexts;  // first members, for reports
    private final String label;  // null until themes are extracted
    private final EmbeddingVector labelVector;  // embedding of the label, null when unavailable

    public int size() {
        return memberIndices.size();
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
