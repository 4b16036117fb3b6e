package com.dcruver.notegraph.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Full link statistics for a notes directory.
 * Collections are unmodifiable since instances are shared through the cache.
 */
@Data
@Builder
public class NoteGraphStats {
    // Increases with every computation, so a reused snapshot keeps its number
    @JsonIgnore
    private final long generation;

    private final int noteCount;
    private final int uniqueConnections;  // distinct (source, target) note pairs
    private final int totalMentions;      // every wikilink occurrence, duplicates included

    // note path -> display titles of linked notes, first appearance order
    private final Map<String, List<String>> forwardLinks;

    // display title -> notes linking to it
    private final Map<String, List<BacklinkEntry>> backlinks;

    private final List<DanglingLink> danglingLinks;
    private final List<String> orphanNotes;
    private final List<NoteInfo> notes;

    public static NoteGraphStats empty() {
        return NoteGraphStats.builder()
            .noteCount(0)
            .uniqueConnections(0)
            .totalMentions(0)
            .forwardLinks(Map.of())
            .backlinks(Map.of())
            .danglingLinks(List.of())
            .orphanNotes(List.of())
            .notes(List.of())
            .build();
    }
}
