package com.dcruver.notegraph.cluster;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Dangling targets connected through pairwise similarity, with the target
 * suggested as the canonical spelling.
 */
@Data
@Builder
public class SimilarLinkCluster {
    private final String id;
    private final String representativeTarget;
    private final List<SimilarLinkMember> members;  // representative first
    private final int totalOccurrences;
    private final double averageSimilarity;

    public int size() {
        return members.size();
    }
}
