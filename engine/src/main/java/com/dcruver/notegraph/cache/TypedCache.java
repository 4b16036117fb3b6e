package com.dcruver.notegraph.cache;

import java.util.List;

/**
 * Coarse TTL cache keyed by {@code "type:identifier"}, with an optional opaque hash
 * instead of per-file dependencies.
 *
 * A thin layer over an {@link IncrementalCache} whose entries have no file
 * dependencies, so expiry and removal behave exactly as in the incremental cache.
 */
public class TypedCache {

    private final IncrementalCache<Object> delegate;

    public TypedCache(IncrementalCache<Object> delegate) {
        this.delegate = delegate;
    }

    /**
     * @return the cached value, or null when absent or expired
     */
    @SuppressWarnings("unchecked")
    public <T> T getCache(String type, String identifier) {
        return (T) delegate.get(createKey(type, identifier));
    }

    public void setCache(String type, String identifier, Object data) {
        setCache(type, identifier, data, null);
    }

    public void setCache(String type, String identifier, Object data, String hash) {
        delegate.set(createKey(type, identifier), data, List.of(), hash);
    }

    public void invalidateCache(String type, String identifier) {
        delegate.delete(createKey(type, identifier));
    }

    public int invalidateCacheByType(String type) {
        return delegate.deleteByPrefix(type + ":").size();
    }

    /**
     * Whether an entry exists, is within its TTL, and (when it was stored with a hash)
     * was stored with {@code currentHash}. Does not remove anything.
     */
    public boolean isCacheValid(String type, String identifier, String currentHash) {
        IncrementalCacheEntry<Object> entry = delegate.peek(createKey(type, identifier));
        if (entry == null || delegate.isExpired(entry, delegate.now())) {
            return false;
        }
        return entry.getFingerprint() == null || entry.getFingerprint().equals(currentHash);
    }

    public void clear() {
        delegate.clear();
    }

    static String createKey(String type, String identifier) {
        return type + ":" + identifier;
    }
}
