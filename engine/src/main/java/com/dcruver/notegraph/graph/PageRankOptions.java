package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PageRankOptions {

    @Builder.Default
    private final double damping = 0.85;

    /** Upper bound on power iterations. */
    @Builder.Default
    private final int iterations = 20;

    /** Iteration stops once the L1 change of the score vector falls below this. */
    @Builder.Default
    private final double tolerance = 1e-6;

    public static PageRankOptions defaults() {
        return PageRankOptions.builder().build();
    }
}
