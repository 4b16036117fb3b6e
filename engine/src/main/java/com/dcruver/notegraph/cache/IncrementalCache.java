package com.dcruver.notegraph.cache;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory cache whose entries are tied to the files they were computed from.
 *
 * An entry is served only while it is younger than the TTL and every dependency
 * is unchanged. Dependencies are checked in two tiers: the modification time is
 * compared first, and the content is re-hashed only when the mtime moved, so a
 * touched-but-identical file keeps the entry valid.
 *
 * A reverse index (file path to dependent keys) makes {@link #invalidateByFile}
 * proportional to the number of dependent keys.
 *
 * Meant to be owned by a single process. Methods are synchronized so a
 * dependency check for one entry always completes before it counts as a hit.
 *
 * @param <T> cached value type
 */
@Slf4j
public class IncrementalCache<T> {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<String, IncrementalCacheEntry<T>> entries = new HashMap<>();
    private final Map<String, Set<String>> keysByFile = new HashMap<>();
    private final Map<String, FileFingerprint> fingerprints = new HashMap<>();

    private final FileHasher hasher;
    private final Duration ttl;
    private final Clock clock;

    public IncrementalCache(FileHasher hasher, Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        this.hasher = hasher;
        this.ttl = ttl;
        this.clock = clock;
    }

    public IncrementalCache(FileHasher hasher, Duration ttl) {
        this(hasher, ttl, Clock.systemUTC());
    }

    public IncrementalCache() {
        this(new FileHasher(), DEFAULT_TTL);
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * Look up a value, validating its age and file dependencies.
     *
     * @param key cache key
     * @return the cached value, or null on a miss or when the entry was invalidated
     */
    public T get(String key) {
        return get(key, null);
    }

    /**
     * Look up a value, validating its age, file dependencies and the optional validator.
     * Invalid entries are removed.
     *
     * @param key       cache key
     * @param validator extra check run after all dependencies passed, may be null
     * @return the cached value, or null on a miss or when the entry was invalidated
     */
    public synchronized T get(String key, CacheValidator validator) {
        IncrementalCacheEntry<T> entry = entries.get(key);

        if (entry == null) {
            log.debug("Cache miss for {}: no entry", key);
            return null;
        }

        if (isExpired(entry, clock.instant())) {
            log.debug("Cache miss for {}: expired", key);
            delete(key);
            return null;
        }

        List<FileDependency> checked = new ArrayList<>(entry.getDependencies().size());
        boolean refreshed = false;

        for (FileDependency dependency : entry.getDependencies()) {
            FileDependency current = validateDependency(dependency);
            if (current == null) {
                log.debug("Cache miss for {}: dependency changed: {}", key, dependency.getPath());
                delete(key);
                return null;
            }
            refreshed |= current != dependency;
            checked.add(current);
        }

        if (validator != null) {
            ValidationResult result = validator.validate();
            if (!result.isValid()) {
                log.debug("Cache miss for {}: validator reported changes in {}", key, result.getChangedFiles());
                delete(key);
                return null;
            }
        }

        if (refreshed) {
            // Same content under a new mtime: record it so the next lookup stays on the fast path
            entries.put(key, entry.withDependencies(List.copyOf(checked)));
        }

        log.debug("Cache hit for {}", key);
        return entry.getData();
    }

    /**
     * Store a value computed from the given files.
     *
     * @param key          cache key
     * @param data         value to store
     * @param dependencies paths of the files the value was derived from
     */
    public void set(String key, T data, Collection<String> dependencies) {
        set(key, data, dependencies, null);
    }

    /**
     * Store a value computed from the given files, with an optional opaque fingerprint.
     * Files that cannot be stat'ed or read now are not recorded as dependencies.
     */
    public synchronized void set(String key, T data, Collection<String> dependencies, String fingerprint) {
        unindex(key);

        List<FileDependency> fileDependencies = new ArrayList<>(dependencies.size());
        for (String dependency : dependencies) {
            String path = normalize(dependency);
            FileDependency fileDependency = fingerprint(path);
            if (fileDependency == null) {
                continue;
            }
            fileDependencies.add(fileDependency);
            keysByFile.computeIfAbsent(path, p -> new HashSet<>()).add(key);
        }

        entries.put(key, IncrementalCacheEntry.<T>builder()
            .data(data)
            .createdAt(clock.instant())
            .dependencies(List.copyOf(fileDependencies))
            .fingerprint(fingerprint)
            .build());

        log.debug("Cached {} with {} file dependencies", key, fileDependencies.size());
    }

    /**
     * Store a value with fingerprints the caller captured while reading the files,
     * so a file saved after it was read invalidates the entry on the next lookup.
     * Nothing is re-read here.
     */
    public synchronized void setWithFingerprints(String key, T data, Collection<FileDependency> dependencies) {
        unindex(key);

        List<FileDependency> fileDependencies = new ArrayList<>(dependencies.size());
        for (FileDependency dependency : dependencies) {
            String path = normalize(dependency.getPath());
            fileDependencies.add(dependency.withPath(path));
            keysByFile.computeIfAbsent(path, p -> new HashSet<>()).add(key);
        }

        entries.put(key, IncrementalCacheEntry.<T>builder()
            .data(data)
            .createdAt(clock.instant())
            .dependencies(List.copyOf(fileDependencies))
            .build());

        log.debug("Cached {} with {} captured file fingerprints", key, fileDependencies.size());
    }

    /**
     * Remove every entry that depends on the given file.
     *
     * @param filePath path of the changed file
     * @return removed keys, sorted
     */
    public synchronized List<String> invalidateByFile(String filePath) {
        String path = normalize(filePath);
        fingerprints.remove(path);

        Set<String> keys = keysByFile.remove(path);
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }

        List<String> removed = new ArrayList<>(keys);
        removed.sort(null);
        for (String key : removed) {
            delete(key);
        }

        log.debug("Invalidated {} cache entries for {}", removed.size(), path);
        return removed;
    }

    public synchronized boolean delete(String key) {
        unindex(key);
        return entries.remove(key) != null;
    }

    /**
     * Remove every entry whose key starts with the prefix.
     *
     * @return removed keys, sorted
     */
    public synchronized List<String> deleteByPrefix(String prefix) {
        List<String> matching = entries.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .sorted()
            .toList();
        matching.forEach(this::delete);
        return matching;
    }

    public synchronized void clear() {
        entries.clear();
        keysByFile.clear();
        fingerprints.clear();
        log.debug("Cleared incremental cache");
    }

    /**
     * Sweep entries past their TTL. Expired entries are also dropped lazily by {@link #get}.
     *
     * @return number of removed entries
     */
    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        List<String> expired = entries.entrySet().stream()
            .filter(e -> isExpired(e.getValue(), now))
            .map(Map.Entry::getKey)
            .toList();
        expired.forEach(this::delete);
        return expired.size();
    }

    public synchronized CacheStats getStats() {
        List<String> keys = new ArrayList<>(entries.keySet());
        keys.sort(null);
        return CacheStats.builder()
            .cacheSize(entries.size())
            .fileHashCacheSize(fingerprints.size())
            .trackedFiles(keysByFile.size())
            .keys(keys)
            .build();
    }

    /**
     * Recorded dependencies of an entry, empty if the key is not cached.
     */
    public synchronized List<FileDependency> getDependencies(String key) {
        IncrementalCacheEntry<T> entry = entries.get(key);
        return entry != null ? entry.getDependencies() : List.of();
    }

    /**
     * Raw entry without any validation, for callers that gate on the fingerprint.
     */
    synchronized IncrementalCacheEntry<T> peek(String key) {
        return entries.get(key);
    }

    boolean isExpired(IncrementalCacheEntry<T> entry, Instant now) {
        return Duration.between(entry.getCreatedAt(), now).compareTo(ttl) >= 0;
    }

    Instant now() {
        return clock.instant();
    }

    /**
     * Check one dependency against the file on disk.
     *
     * @return the dependency (refreshed if only the mtime moved), or null if the file changed or vanished
     */
    private FileDependency validateDependency(FileDependency dependency) {
        Path file = Path.of(dependency.getPath());

        Instant mtime;
        try {
            mtime = hasher.lastModified(file);
        } catch (IOException e) {
            log.debug("Dependency no longer readable: {}", dependency.getPath());
            return null;
        }

        if (mtime.equals(dependency.getMtime())) {
            return dependency;
        }

        String hash;
        try {
            hash = hasher.hash(file);
        } catch (IOException e) {
            log.debug("Dependency no longer readable: {}", dependency.getPath());
            return null;
        }

        fingerprints.put(dependency.getPath(), new FileFingerprint(hash, mtime));

        if (!hash.equals(dependency.getHash())) {
            return null;
        }
        return dependency.withMtime(mtime);
    }

    /**
     * Fingerprint a file for a new entry, reusing the memoized hash while the mtime is unchanged.
     */
    private FileDependency fingerprint(String path) {
        Path file = Path.of(path);
        try {
            Instant mtime = hasher.lastModified(file);
            FileFingerprint known = fingerprints.get(path);

            String hash;
            if (known != null && known.getMtime().equals(mtime)) {
                hash = known.getHash();
            } else {
                hash = hasher.hash(file);
                fingerprints.put(path, new FileFingerprint(hash, mtime));
            }

            return FileDependency.builder()
                .path(path)
                .hash(hash)
                .mtime(mtime)
                .build();
        } catch (IOException e) {
            log.debug("Skipping unreadable dependency {}: {}", path, e.getMessage());
            return null;
        }
    }

    private void unindex(String key) {
        IncrementalCacheEntry<T> previous = entries.get(key);
        if (previous == null) {
            return;
        }
        for (FileDependency dependency : previous.getDependencies()) {
            Set<String> keys = keysByFile.get(dependency.getPath());
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    keysByFile.remove(dependency.getPath());
                }
            }
        }
    }

    static String normalize(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }

    @Data
    @Builder
    private static class FileFingerprint {
        private final String hash;
        private final Instant mtime;
    }
}
