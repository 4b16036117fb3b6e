package com.dcruver.notegraph.cluster;

import com.dcruver.notegraph.graph.DanglingLink;
import com.dcruver.notegraph.similarity.SimilarityScore;
import lombok.Builder;
import lombok.Data;

/**
 * A dangling link close to a searched target.
 */
@Data
@Builder
public class SimilarDanglingLink {
    private final DanglingLink danglingLink;
    private final SimilarityScore similarity;
}
