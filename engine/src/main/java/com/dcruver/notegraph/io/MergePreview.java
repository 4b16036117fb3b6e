package com.dcruver.notegraph.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What a merge would change in one file.
 */
@Data
@Builder
public class MergePreview {
    private final String filePath;
    private final List<Match> matches;
    private final String diff;  // unified diff of the whole file

    @Data
    @Builder
    public static class Match {
        private final String original;
        private final String replaced;
        private final int line;  // 1-based
    }
}
