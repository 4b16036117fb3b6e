package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Data;

/**
 * Numeric projection of {@link NoteGraphStats} for status displays.
 */
@Data
@Builder
public class QuickNoteStats {
    private final int noteCount;
    private final int connectionCount;
    private final int danglingCount;
    private final int orphanCount;

    public static QuickNoteStats from(NoteGraphStats stats) {
        return QuickNoteStats.builder()
            .noteCount(stats.getNoteCount())
            .connectionCount(stats.getUniqueConnections())
            .danglingCount(stats.getDanglingLinks().size())
            .orphanCount(stats.getOrphanNotes().size())
            .build();
    }
}
