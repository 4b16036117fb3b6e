package com.dcruver.notegraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * A note that references another note. One entry per source note.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BacklinkEntry {
    private final String sourceNoteId;
    private final String sourceTitle;
    private final String sourcePath;
    private final String context;
    private final String alias;
}
