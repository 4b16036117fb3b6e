package com.dcruver.notegraph.cache;

/**
 * Extra validity check consulted after all file dependencies passed.
 */
@FunctionalInterface
public interface CacheValidator {
    ValidationResult validate();
}
