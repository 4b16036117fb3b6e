package com.dcruver.notegraph.cache;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records how often content hashes and mtimes were computed.
 */
public class CountingFileHasher extends FileHasher {

    private final AtomicInteger hashes = new AtomicInteger();
    private final AtomicInteger stats = new AtomicInteger();

    @Override
    public String hash(Path file) throws IOException {
        hashes.incrementAndGet();
        return super.hash(file);
    }

    @Override
    public Instant lastModified(Path file) throws IOException {
        stats.incrementAndGet();
        return super.lastModified(file);
    }

    public int getHashCount() {
        return hashes.get();
    }

    public int getStatCount() {
        return stats.get();
    }

    public void reset() {
        hashes.set(0);
        stats.set(0);
    }
}
