package com.dcruver.notegraph.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Watches a notes directory and invalidates cache entries as Markdown files change.
 *
 * Events are debounced per file so an editor's burst of writes costs one
 * invalidation. A created or deleted file also changes which files exist,
 * which no existing entry depends on yet, so those events additionally run the
 * directory-level invalidator.
 */
@Slf4j
public class NoteFileWatcher {

    private final Path notesDir;
    private final IncrementalCache<?> cache;
    private final Function<Path, List<String>> directoryInvalidator;
    private final Duration debounce;

    private final ScheduledExecutorService scheduler;
    private final Map<Path, ScheduledFuture<?>> pendingInvalidations = new ConcurrentHashMap<>();
    private final Map<Path, Boolean> pendingStructuralChanges = new ConcurrentHashMap<>();
    private final Map<WatchKey, Path> watchedDirs = new ConcurrentHashMap<>();
    private final List<Consumer<CacheInvalidatedEvent>> listeners = new CopyOnWriteArrayList<>();

    private WatchService watchService;
    private Thread pollThread;

    /**
     * @param notesDir             directory to watch recursively
     * @param cache                cache holding entries that depend on note files
     * @param directoryInvalidator drops directory-level entries, returns removed keys
     * @param debounce             quiet period per file before invalidating
     */
    public NoteFileWatcher(Path notesDir, IncrementalCache<?> cache,
                           Function<Path, List<String>> directoryInvalidator, Duration debounce) {
        this.notesDir = notesDir.toAbsolutePath().normalize();
        this.cache = cache;
        this.directoryInvalidator = directoryInvalidator;
        this.debounce = debounce;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "note-watcher-debounce");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(Consumer<CacheInvalidatedEvent> listener) {
        listeners.add(listener);
    }

    public synchronized void start() throws IOException {
        if (watchService != null) {
            return;
        }
        if (!Files.isDirectory(notesDir)) {
            log.warn("Not watching {}: not a directory", notesDir);
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        registerTree(notesDir);

        pollThread = new Thread(this::pollLoop, "note-watcher");
        pollThread.setDaemon(true);
        pollThread.start();

        log.info("Watching {} ({} directories, debounce {}ms)",
            notesDir, watchedDirs.size(), debounce.toMillis());
    }

    public synchronized void stop() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service for {}: {}", notesDir, e.getMessage());
            }
            watchService = null;
        }
        pendingInvalidations.values().forEach(future -> future.cancel(false));
        pendingInvalidations.clear();
        pendingStructuralChanges.clear();
        watchedDirs.clear();
        scheduler.shutdownNow();
        log.info("Stopped watching {}", notesDir);
    }

    /**
     * Handle one file-system event on a Markdown file: schedule a debounced invalidation.
     */
    void onFileEvent(Path file, WatchEvent.Kind<?> kind) {
        Path path = file.toAbsolutePath().normalize();
        if (!path.getFileName().toString().endsWith(".md")) {
            return;
        }

        if (kind == StandardWatchEventKinds.ENTRY_CREATE || kind == StandardWatchEventKinds.ENTRY_DELETE) {
            pendingStructuralChanges.put(path, Boolean.TRUE);
        }

        ScheduledFuture<?> previous = pendingInvalidations.get(path);
        if (previous != null) {
            previous.cancel(false);
        }

        pendingInvalidations.put(path, scheduler.schedule(() -> {
            try {
                invalidate(path);
            } catch (Exception e) {
                log.error("Error invalidating cache for {}: {}", path, e.getMessage(), e);
            } finally {
                pendingInvalidations.remove(path);
            }
        }, debounce.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void invalidate(Path path) {
        List<String> invalidated = new ArrayList<>(cache.invalidateByFile(path.toString()));

        if (pendingStructuralChanges.remove(path) != null) {
            for (String key : directoryInvalidator.apply(notesDir)) {
                if (!invalidated.contains(key)) {
                    invalidated.add(key);
                }
            }
        }

        if (invalidated.isEmpty()) {
            return;
        }

        log.debug("File {} changed, invalidated {}", path, invalidated);
        CacheInvalidatedEvent event = CacheInvalidatedEvent.builder()
            .filePath(path.toString())
            .invalidated(List.copyOf(invalidated))
            .build();
        for (Consumer<CacheInvalidatedEvent> listener : listeners) {
            listener.accept(event);
        }
    }

    private void pollLoop() {
        WatchService service = watchService;
        while (true) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = watchedDirs.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handleEvent(dir, event);
                }
            }

            if (!key.reset()) {
                watchedDirs.remove(key);
            }
        }
    }

    private void handleEvent(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();

        if (kind == StandardWatchEventKinds.OVERFLOW) {
            log.warn("Watch events overflowed for {}, dropping directory-level cache entries", dir);
            directoryInvalidator.apply(notesDir);
            return;
        }

        Path child = dir.resolve((Path) event.context());

        if (kind == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
            if (child.getFileName().toString().startsWith(".")) {
                return;
            }
            try {
                registerTree(child);
            } catch (IOException e) {
                log.warn("Failed to watch new directory {}: {}", child, e.getMessage());
            }
            return;
        }

        onFileEvent(child, kind);
    }

    private void registerTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_DELETE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
                watchedDirs.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Cannot watch {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
