package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

/**
 * Identity of a note derived on each scan. Never persisted.
 */
@Data
@Builder
public class NoteInfo {
    private final String id;        // frontmatter id, else basename
    private final String title;     // frontmatter title, else basename
    private final String path;      // absolute, normalized
    private final String basename;  // file name without .md
}
