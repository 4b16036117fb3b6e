package com.dcruver.notegraph.similarity;

import lombok.Builder;
import lombok.Data;

/**
 * Two indices into a string list whose similarity passed a threshold.
 */
@Data
@Builder
public class SimilarPair {
    private final int firstIndex;
    private final int secondIndex;
    private final SimilarityScore similarity;
}
