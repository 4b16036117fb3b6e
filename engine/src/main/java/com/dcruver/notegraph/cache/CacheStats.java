package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Cache statistics.
 */
@Data
@Builder
public class CacheStats {
    private final int cacheSize;
    private final int fileHashCacheSize;
    private final int trackedFiles;
    private final List<String> keys;
}
