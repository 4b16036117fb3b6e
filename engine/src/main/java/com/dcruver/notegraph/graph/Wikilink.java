package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

/**
 * A single [[target#section|alias]] occurrence in note content.
 * The target is kept as written; normalization happens at match time.
 */
@Data
@Builder
public class Wikilink {
    private final String raw;
    private final String target;
    private final String section;  // null when absent
    private final String alias;    // null when absent
    private final Position position;

    @Data
    @Builder
    public static class Position {
        private final int start;  // zero-based offset into the whole content
        private final int end;    // exclusive
        private final int line;   // zero-based
    }
}
