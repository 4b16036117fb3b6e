package com.dcruver.notegraph.similarity;

import lombok.Builder;
import lombok.Data;

/**
 * Composite similarity of two strings with the individual measures it was built from.
 * All values are in [0, 1].
 */
@Data
@Builder
public class SimilarityScore {
    private final double score;
    private final double jaroWinkler;
    private final double ngram;
    private final double tokenOverlap;
    private final double containment;

    static SimilarityScore identical() {
        return new SimilarityScore(1, 1, 1, 1, 1);
    }
}
