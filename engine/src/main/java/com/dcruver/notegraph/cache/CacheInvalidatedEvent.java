package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Published by {@link NoteFileWatcher} when a file change removed cache entries.
 */
@Data
@Builder
public class CacheInvalidatedEvent {
    private final String filePath;
    private final List<String> invalidated;
}
