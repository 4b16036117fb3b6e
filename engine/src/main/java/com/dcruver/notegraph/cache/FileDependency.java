package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * Fingerprint of one file a cache entry was computed from.
 */
@Data
@Builder
@With
public class FileDependency {
    private final String path;
    private final String hash;     // truncated SHA-256
    private final Instant mtime;
}
