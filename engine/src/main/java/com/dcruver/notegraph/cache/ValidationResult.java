package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a caller-supplied {@link CacheValidator}.
 */
@Data
@Builder
public class ValidationResult {
    private final boolean valid;
    private final List<String> changedFiles;

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult changed(List<String> changedFiles) {
        return new ValidationResult(false, List.copyOf(changedFiles));
    }
}
