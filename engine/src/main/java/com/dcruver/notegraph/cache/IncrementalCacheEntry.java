package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Cached value together with the files it was derived from.
 */
@Data
@Builder
@With
public class IncrementalCacheEntry<T> {
    private final T data;
    private final Instant createdAt;
    private final List<FileDependency> dependencies;

    // Opaque caller-supplied hash, only used by TypedCache
    private final String fingerprint;
}
