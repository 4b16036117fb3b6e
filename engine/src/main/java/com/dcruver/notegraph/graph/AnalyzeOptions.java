package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

/**
 * Options for {@link NoteGraphAnalyzer#analyzeNoteGraph}.
 */
@Data
@Builder
public class AnalyzeOptions {

    /** Attach surrounding text to backlink entries. */
    @Builder.Default
    private final boolean includeContext = false;

    @Builder.Default
    private final int contextLength = WikilinkParser.DEFAULT_CONTEXT_LENGTH;

    /** Serve from and store into the incremental cache. */
    @Builder.Default
    private final boolean useCache = true;

    public static AnalyzeOptions defaults() {
        return AnalyzeOptions.builder().build();
    }
}
