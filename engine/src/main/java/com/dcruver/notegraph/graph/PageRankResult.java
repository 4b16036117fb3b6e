package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * PageRank scores keyed by note path, scaled so the best-ranked note scores 1.
 */
@Data
@Builder
public class PageRankResult {
    private final Map<String, Double> scores;
    private final int iterations;
    private final boolean converged;

    static PageRankResult empty() {
        return new PageRankResult(Map.of(), 0, true);
    }
}
