package com.dcruver.notegraph.graph;

import com.dcruver.notegraph.cache.CacheValidator;
import com.dcruver.notegraph.cache.FileDependency;
import com.dcruver.notegraph.cache.IncrementalCache;
import com.dcruver.notegraph.cache.ValidationResult;
import com.dcruver.notegraph.config.NoteGraphProperties;
import com.dcruver.notegraph.io.MarkdownNote;
import com.dcruver.notegraph.io.MarkdownNoteReader;
import com.dcruver.notegraph.io.NoteFileWalker;
import com.dcruver.notegraph.io.NotePaths;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the wikilink graph of a notes directory: forward links, backlinks,
 * dangling links and orphan notes.
 *
 * Files are read and parsed in parallel, then merged in path order so the
 * result does not depend on scheduling. Results are cached per directory with
 * every note file as a dependency; a cached result is also dropped when the set
 * of note files changed.
 */
@Component
@Slf4j
public class NoteGraphAnalyzer {

    static final String CACHE_TYPE = "graph-stats";

    private final NoteFileWalker walker;
    private final MarkdownNoteReader reader;
    private final IncrementalCache<NoteGraphStats> cache;
    private final ExecutorService ioPool;
    private final int defaultContextLength;
    private final AtomicLong generations = new AtomicLong();

    @Autowired
    public NoteGraphAnalyzer(NoteFileWalker walker, MarkdownNoteReader reader,
                             IncrementalCache<NoteGraphStats> cache, NoteGraphProperties properties) {
        this(walker, reader, cache, properties.getIoConcurrency(), properties.getContextLength());
    }

    public NoteGraphAnalyzer(NoteFileWalker walker, MarkdownNoteReader reader,
                             IncrementalCache<NoteGraphStats> cache, int ioConcurrency, int defaultContextLength) {
        if (ioConcurrency < 1) {
            throw new IllegalArgumentException("ioConcurrency must be at least 1: " + ioConcurrency);
        }
        this.walker = walker;
        this.reader = reader;
        this.cache = cache;
        this.defaultContextLength = defaultContextLength;

        AtomicInteger threadCount = new AtomicInteger();
        this.ioPool = Executors.newFixedThreadPool(ioConcurrency, r -> {
            Thread thread = new Thread(r, "note-reader-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        ioPool.shutdownNow();
    }

    public int getDefaultContextLength() {
        return defaultContextLength;
    }

    public NoteGraphStats analyzeNoteGraph(String notesDir) {
        return analyzeNoteGraph(notesDir, AnalyzeOptions.defaults());
    }

    /**
     * Analyze every note under a directory.
     *
     * @param notesDir notes directory, {@code ~} is expanded
     * @param options  context and caching options
     * @return graph statistics, empty when the directory does not exist
     */
    public NoteGraphStats analyzeNoteGraph(String notesDir, AnalyzeOptions options) {
        Path dir = NotePaths.expand(notesDir);
        String cacheKey = cacheKey(dir, options);

        if (options.isUseCache()) {
            NoteGraphStats cached = cache.get(cacheKey, fileSetValidator(dir, cacheKey));
            if (cached != null) {
                return cached;
            }
        }

        List<Path> files = walker.listMarkdownFiles(dir);
        log.info("Analyzing {} notes in {}", files.size(), dir);

        List<ParsedNote> parsed = readAll(files);
        NoteGraphStats stats = buildStats(parsed, options);

        if (options.isUseCache()) {
            List<FileDependency> dependencies = new ArrayList<>(parsed.size());
            for (ParsedNote note : parsed) {
                if (note.dependency != null) {
                    dependencies.add(note.dependency);
                }
            }
            cache.setWithFingerprints(cacheKey, stats, dependencies);
        }

        log.info("Graph for {}: {} notes, {} connections, {} dangling, {} orphans",
            dir, stats.getNoteCount(), stats.getUniqueConnections(),
            stats.getDanglingLinks().size(), stats.getOrphanNotes().size());
        return stats;
    }

    /**
     * Notes linking to the given note, with context. Tries the exact backlink key
     * first, then the normalized title.
     */
    public List<BacklinkEntry> getBacklinksForNote(String notesDir, String noteTitle) {
        NoteGraphStats stats = analyzeNoteGraph(notesDir, AnalyzeOptions.builder()
            .includeContext(true)
            .contextLength(defaultContextLength)
            .build());

        List<BacklinkEntry> direct = stats.getBacklinks().get(noteTitle);
        if (direct != null) {
            return direct;
        }

        String normalized = WikilinkParser.normalizeNoteTitle(noteTitle);
        for (Map.Entry<String, List<BacklinkEntry>> entry : stats.getBacklinks().entrySet()) {
            if (WikilinkParser.normalizeNoteTitle(entry.getKey()).equals(normalized)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public List<DanglingLink> findDanglingLinks(String notesDir) {
        return analyzeNoteGraph(notesDir).getDanglingLinks();
    }

    public List<String> findOrphanNotes(String notesDir) {
        return analyzeNoteGraph(notesDir).getOrphanNotes();
    }

    public QuickNoteStats getQuickStats(String notesDir) {
        return QuickNoteStats.from(analyzeNoteGraph(notesDir));
    }

    /**
     * Drop every cached result for the directory.
     *
     * @return removed cache keys
     */
    public List<String> invalidateGraphCache(String notesDir) {
        return invalidateGraphCache(NotePaths.expand(notesDir));
    }

    public List<String> invalidateGraphCache(Path notesDir) {
        List<String> removed = cache.deleteByPrefix(cacheKeyPrefix(notesDir.toAbsolutePath().normalize()));
        if (!removed.isEmpty()) {
            log.debug("Invalidated graph cache for {}: {}", notesDir, removed);
        }
        return removed;
    }

    static String cacheKeyPrefix(Path dir) {
        return CACHE_TYPE + ":" + dir + "#";
    }

    static String cacheKey(Path dir, AnalyzeOptions options) {
        String variant = options.isIncludeContext() ? "context=" + options.getContextLength() : "plain";
        return cacheKeyPrefix(dir) + variant;
    }

    /**
     * Invalidates a cached result when a note file was added or removed, which the
     * per-file dependency checks cannot see.
     */
    private CacheValidator fileSetValidator(Path dir, String cacheKey) {
        return () -> {
            Set<String> cachedFiles = new HashSet<>();
            for (FileDependency dependency : cache.getDependencies(cacheKey)) {
                cachedFiles.add(dependency.getPath());
            }

            List<String> changed = new ArrayList<>();
            Set<String> currentFiles = new HashSet<>();
            for (Path file : walker.listMarkdownFiles(dir)) {
                String path = file.toAbsolutePath().normalize().toString();
                currentFiles.add(path);
                if (!cachedFiles.contains(path)) {
                    changed.add(path);
                }
            }
            for (String path : cachedFiles) {
                if (!currentFiles.contains(path)) {
                    changed.add(path);
                }
            }

            return changed.isEmpty() ? ValidationResult.ok() : ValidationResult.changed(changed);
        };
    }

    private List<ParsedNote> readAll(List<Path> files) {
        List<Future<ParsedNote>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(ioPool.submit(() -> readNote(file)));
        }

        List<ParsedNote> parsed = new ArrayList<>(files.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                parsed.add(futures.get(i).get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while reading notes", e);
            } catch (ExecutionException e) {
                Path file = files.get(i);
                log.warn("Cannot process file {}: {}", file, e.getCause().getMessage());
                parsed.add(new ParsedNote(fallbackInfo(file), null, null));
            }
        }
        return parsed;
    }

    private ParsedNote readNote(Path file) {
        try {
            MarkdownNote note = reader.read(file);
            String basename = NotePaths.basename(file);

            String title = note.getFrontmatterString("title");
            String id = note.getFrontmatterString("id");

            NoteInfo info = NoteInfo.builder()
                .id(id != null ? id : basename)
                .title(title != null ? title : basename)
                .path(file.toAbsolutePath().normalize().toString())
                .basename(basename)
                .build();
            FileDependency dependency = FileDependency.builder()
                .path(info.getPath())
                .hash(note.getContentHash())
                .mtime(note.getLastModified())
                .build();
            return new ParsedNote(info, note.getRawContent(), dependency);
        } catch (IOException e) {
            log.warn("Cannot read note {}: {}", file, e.getMessage());
            return new ParsedNote(fallbackInfo(file), null, null);
        }
    }

    private NoteInfo fallbackInfo(Path file) {
        String basename = NotePaths.basename(file);
        return NoteInfo.builder()
            .id(basename)
            .title(basename)
            .path(file.toAbsolutePath().normalize().toString())
            .basename(basename)
            .build();
    }

    private NoteGraphStats buildStats(List<ParsedNote> parsed, AnalyzeOptions options) {
        // Normalized title, basename and id -> note. Titles win over basenames and ids of other notes.
        Map<String, NoteInfo> existingNotes = new HashMap<>();
        for (ParsedNote note : parsed) {
            existingNotes.put(WikilinkParser.normalizeNoteTitle(note.info.getTitle()), note.info);
        }
        for (ParsedNote note : parsed) {
            existingNotes.putIfAbsent(WikilinkParser.normalizeNoteTitle(note.info.getBasename()), note.info);
            existingNotes.putIfAbsent(WikilinkParser.normalizeNoteTitle(note.info.getId()), note.info);
        }

        Map<String, List<String>> forwardLinks = new LinkedHashMap<>();
        Map<String, List<BacklinkEntry>> backlinks = new LinkedHashMap<>();
        Map<String, Set<String>> backlinkSources = new HashMap<>();
        Set<String> connectionPairs = new HashSet<>();
        Map<String, Map<String, DanglingSourceCounter>> dangling = new LinkedHashMap<>();
        int totalMentions = 0;

        for (ParsedNote note : parsed) {
            NoteInfo source = note.info;

            if (note.content == null) {
                forwardLinks.put(source.getPath(), List.of());
                continue;
            }

            List<Wikilink> links = WikilinkParser.parseWikilinks(note.content);
            totalMentions += links.size();

            Set<String> linkedTitles = new LinkedHashSet<>();

            for (Wikilink link : links) {
                NoteInfo target = existingNotes.get(WikilinkParser.normalizeNoteTitle(link.getTarget()));

                if (target != null) {
                    linkedTitles.add(target.getTitle());
                    connectionPairs.add(source.getPath() + "::" + target.getPath());

                    if (backlinkSources.computeIfAbsent(target.getTitle(), t -> new HashSet<>()).add(source.getPath())) {
                        backlinks.computeIfAbsent(target.getTitle(), t -> new ArrayList<>())
                            .add(BacklinkEntry.builder()
                                .sourceNoteId(source.getId())
                                .sourceTitle(source.getTitle())
                                .sourcePath(source.getPath())
                                .alias(link.getAlias())
                                .context(options.isIncludeContext()
                                    ? WikilinkParser.extractContext(note.content, link, options.getContextLength())
                                    : null)
                                .build());
                    }
                } else {
                    dangling.computeIfAbsent(link.getTarget(), t -> new LinkedHashMap<>())
                        .computeIfAbsent(source.getPath(), p -> new DanglingSourceCounter(source))
                        .count++;
                }
            }

            forwardLinks.put(source.getPath(), List.copyOf(linkedTitles));
        }

        List<DanglingLink> danglingLinks = new ArrayList<>(dangling.size());
        for (Map.Entry<String, Map<String, DanglingSourceCounter>> entry : dangling.entrySet()) {
            danglingLinks.add(DanglingLink.builder()
                .target(entry.getKey())
                .sources(entry.getValue().values().stream()
                    .map(DanglingSourceCounter::toSource)
                    .toList())
                .build());
        }

        List<String> orphanNotes = new ArrayList<>();
        for (ParsedNote note : parsed) {
            boolean hasOutgoing = !forwardLinks.getOrDefault(note.info.getPath(), List.of()).isEmpty();
            boolean hasIncoming = backlinks.containsKey(note.info.getTitle());
            if (!hasOutgoing && !hasIncoming) {
                orphanNotes.add(note.info.getPath());
            }
        }

        Map<String, List<BacklinkEntry>> frozenBacklinks = new LinkedHashMap<>();
        backlinks.forEach((title, entries) -> frozenBacklinks.put(title, List.copyOf(entries)));

        return NoteGraphStats.builder()
            .generation(generations.incrementAndGet())
            .noteCount(parsed.size())
            .uniqueConnections(connectionPairs.size())
            .totalMentions(totalMentions)
            .forwardLinks(Collections.unmodifiableMap(forwardLinks))
            .backlinks(Collections.unmodifiableMap(frozenBacklinks))
            .danglingLinks(List.copyOf(danglingLinks))
            .orphanNotes(List.copyOf(orphanNotes))
            .notes(parsed.stream().map(p -> p.info).toList())
            .build();
    }

    private static final class ParsedNote {
        private final NoteInfo info;
        private final String content;  // null when the file could not be read
        private final FileDependency dependency;  // fingerprint of what was read, null when unreadable

        private ParsedNote(NoteInfo info, String content, FileDependency dependency) {
            this.info = info;
            this.content = content;
            this.dependency = dependency;
        }
    }

    private static final class DanglingSourceCounter {
        private final NoteInfo note;
        private int count;

        private DanglingSourceCounter(NoteInfo note) {
            this.note = note;
        }

        private DanglingLink.Source toSource() {
            return DanglingLink.Source.builder()
                .noteId(note.getId())
                .notePath(note.getPath())
                .noteTitle(note.getTitle())
                .count(count)
                .build();
        }
    }
}
