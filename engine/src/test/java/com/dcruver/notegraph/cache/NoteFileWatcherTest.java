package com.dcruver.notegraph.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NoteFileWatcherTest {

    private IncrementalCache<String> cache;
    private NoteFileWatcher watcher;
    private final AtomicInteger directoryInvalidations = new AtomicInteger();
    private final BlockingQueue<CacheInvalidatedEvent> events = new LinkedBlockingQueue<>();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        cache = new IncrementalCache<>();
        watcher = new NoteFileWatcher(tempDir, cache, dir -> {
            directoryInvalidations.incrementAndGet();
            return List.of("graph-stats:" + dir + "#plain");
        }, Duration.ofMillis(50));
        watcher.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void testModificationInvalidatesDependentEntries() throws Exception {
        Path note = tempDir.resolve("a.md");
        Files.writeString(note, "alpha");
        cache.set("note:a", "value", List.of(note.toString()));

        watcher.onFileEvent(note, StandardWatchEventKinds.ENTRY_MODIFY);

        CacheInvalidatedEvent event = events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event);
        assertEquals(note.toString(), event.getFilePath());
        assertEquals(List.of("note:a"), event.getInvalidated());
        assertEquals(0, directoryInvalidations.get(), "Modifications do not change the file set");
        assertEquals(0, cache.getStats().getCacheSize());
    }

    @Test
    void testBurstOfEventsIsDebounced() throws Exception {
        Path note = tempDir.resolve("a.md");
        Files.writeString(note, "alpha");
        cache.set("note:a", "value", List.of(note.toString()));

        for (int i = 0; i < 5; i++) {
            watcher.onFileEvent(note, StandardWatchEventKinds.ENTRY_MODIFY);
        }

        assertNotNull(events.poll(5, TimeUnit.SECONDS));
        assertNull(events.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void testCreatedFileInvalidatesDirectoryEntries() throws Exception {
        Path note = tempDir.resolve("new.md");
        Files.writeString(note, "fresh");

        watcher.onFileEvent(note, StandardWatchEventKinds.ENTRY_CREATE);

        CacheInvalidatedEvent event = events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event);
        assertEquals(List.of("graph-stats:" + tempDir.toAbsolutePath().normalize() + "#plain"), event.getInvalidated());
        assertEquals(1, directoryInvalidations.get());
    }

    @Test
    void testNonMarkdownFilesAreIgnored() throws Exception {
        watcher.onFileEvent(tempDir.resolve("image.png"), StandardWatchEventKinds.ENTRY_CREATE);

        assertNull(events.poll(300, TimeUnit.MILLISECONDS));
        assertEquals(0, directoryInvalidations.get());
    }

    @Test
    void testNoEventWhenNothingWasCached() throws Exception {
        watcher.onFileEvent(tempDir.resolve("a.md"), StandardWatchEventKinds.ENTRY_MODIFY);

        assertNull(events.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void testWatchesRealFileSystem() throws Exception {
        Path note = tempDir.resolve("a.md");
        Files.writeString(note, "alpha");
        cache.set("note:a", "value", List.of(note.toString()));

        watcher.start();
        Files.writeString(note, "alpha, edited");

        CacheInvalidatedEvent event = events.poll(30, TimeUnit.SECONDS);
        assertNotNull(event, "Expected an invalidation from the watch service");
        assertTrue(event.getInvalidated().contains("note:a"));
    }
}
