package com.dcruver.notegraph.cluster;

import com.dcruver.notegraph.graph.DanglingLink;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One dangling target inside a cluster.
 */
@Data
@Builder
public class SimilarLinkMember {
    private final String target;
    private final double similarity;  // to the cluster's representative, 1 for the representative
    private final List<DanglingLink.Source> sources;
}
