package com.dcruver.notegraph.cluster;

import lombok.Builder;
import lombok.Data;

/**
 * Knobs bounding the cost and output of dangling-link clustering.
 */
@Data
@Builder
public class ClusterOptions {

    /** Minimum composite similarity for two targets to be joined. */
    @Builder.Default
    private final double threshold = 0.7;

    @Builder.Default
    private final int minClusterSize = 2;

    @Builder.Default
    private final int maxResults = 50;

    /** Distinct targets scored pairwise before the input is cut down to the most referenced. */
    @Builder.Default
    private final int maxTargets = 1000;

    /** Score every target even above {@link #maxTargets}. */
    @Builder.Default
    private final boolean allowLargeInput = false;

    public static ClusterOptions defaults() {
        return ClusterOptions.builder().build();
    }

    void validate() {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (minClusterSize < 1) {
            throw new IllegalArgumentException("minClusterSize must be positive: " + minClusterSize);
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        if (maxTargets < 2) {
            throw new IllegalArgumentException("maxTargets must be at least 2: " + maxTargets);
        }
    }
}
