package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A link target that matches no note, with every note referencing it.
 */
@Data
@Builder
public class DanglingLink {
    private final String target;
    private final List<Source> sources;

    /**
     * Total number of occurrences across all source notes.
     */
    public int getTotalOccurrences() {
        return sources.stream().mapToInt(Source::getCount).sum();
    }

    @Data
    @Builder
    public static class Source {
        private final String noteId;
        private final String notePath;
        private final String noteTitle;
        private final int count;
    }
}
