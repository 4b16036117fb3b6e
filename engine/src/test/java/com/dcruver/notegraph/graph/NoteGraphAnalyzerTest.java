package com.dcruver.notegraph.graph;

import com.dcruver.notegraph.cache.CountingFileHasher;
import com.dcruver.notegraph.cache.IncrementalCache;
import com.dcruver.notegraph.io.FileSystemNoteWalker;
import com.dcruver.notegraph.io.MarkdownNote;
import com.dcruver.notegraph.io.MarkdownNoteReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class NoteGraphAnalyzerTest {

    private CountingFileHasher hasher;
    private IncrementalCache<NoteGraphStats> cache;
    private NoteGraphAnalyzer analyzer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        hasher = new CountingFileHasher();
        cache = new IncrementalCache<>(hasher, Duration.ofMinutes(5));
        analyzer = new NoteGraphAnalyzer(new FileSystemNoteWalker(), new MarkdownNoteReader(), cache, 4, 50);
    }

    @AfterEach
    void tearDown() {
        analyzer.shutdown();
    }

    private Path note(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private String path(String name) {
        return tempDir.resolve(name).toString();
    }

    @Test
    void testOrphansAndBacklinks() throws Exception {
        note("A.md", "[[B]]");
        note("B.md", "[[A]]");
        note("C.md", "no links");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertEquals(3, stats.getNoteCount());
        assertEquals(List.of(path("C.md")), stats.getOrphanNotes());

        List<BacklinkEntry> toA = stats.getBacklinks().get("A");
        assertEquals(1, toA.size());
        assertEquals(path("B.md"), toA.get(0).getSourcePath());

        List<BacklinkEntry> toB = stats.getBacklinks().get("B");
        assertEquals(1, toB.size());
        assertEquals(path("A.md"), toB.get(0).getSourcePath());

        assertTrue(stats.getDanglingLinks().isEmpty());
        assertEquals(List.of("B"), stats.getForwardLinks().get(path("A.md")));
        assertEquals(List.of(), stats.getForwardLinks().get(path("C.md")));
    }

    @Test
    void testDanglingLinks() throws Exception {
        note("A.md", "[[Missing Note]]");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertEquals(1, stats.getDanglingLinks().size());
        DanglingLink dangling = stats.getDanglingLinks().get(0);
        assertEquals("Missing Note", dangling.getTarget());
        assertEquals(1, dangling.getSources().size());
        assertEquals(path("A.md"), dangling.getSources().get(0).getNotePath());
        assertEquals(1, dangling.getSources().get(0).getCount());

        // A note whose only links are dangling has no forward links
        assertEquals(List.of(path("A.md")), stats.getOrphanNotes());
    }

    @Test
    void testDanglingLinksAggregateSourcesAndCounts() throws Exception {
        note("A.md", "[[Ghost]] and [[Ghost|again]] and [[Ghost#part]]");
        note("B.md", "[[Ghost]]");

        DanglingLink dangling = analyzer.findDanglingLinks(tempDir.toString()).get(0);

        assertEquals(2, dangling.getSources().size());
        assertEquals(3, dangling.getSources().get(0).getCount());
        assertEquals(1, dangling.getSources().get(1).getCount());
        assertEquals(4, dangling.getTotalOccurrences());
    }

    @Test
    void testConnectionsAndMentions() throws Exception {
        note("A.md", "[[B]] [[B]] [[C]] [[b.md]]");
        note("B.md", "[[C]]");
        note("C.md", "");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertEquals(5, stats.getTotalMentions());
        assertEquals(3, stats.getUniqueConnections());
        assertEquals(List.of("B", "C"), stats.getForwardLinks().get(path("A.md")));
        assertEquals(2, stats.getBacklinks().get("C").size());
    }

    @Test
    void testMatchesByFrontmatterTitleBasenameAndId() throws Exception {
        note("2025-plan.md", """
            ---
            title: Project Plan
            id: plan-id
            ---
            Plan body
            """);
        note("A.md", "[[project plan]] then [[2025_plan]] then [[Plan-ID]]");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertTrue(stats.getDanglingLinks().isEmpty());
        assertEquals(List.of("Project Plan"), stats.getForwardLinks().get(path("A.md")));
        assertEquals(1, stats.getBacklinks().get("Project Plan").size(), "Backlinks are deduplicated per source");
        assertEquals(1, stats.getUniqueConnections());
        assertEquals(3, stats.getTotalMentions());
        assertTrue(stats.getOrphanNotes().isEmpty());
    }

    @Test
    void testSubdirectoriesAndHiddenDirectories() throws Exception {
        note("projects/deep/Target.md", "deep note");
        note(".trash/Old.md", "[[Target]]");
        note("A.md", "[[Target]] [[Old]]");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertEquals(2, stats.getNoteCount());
        assertEquals(List.of("Target"), stats.getForwardLinks().get(path("A.md")));
        assertEquals("Old", stats.getDanglingLinks().get(0).getTarget());
    }

    @Test
    void testBacklinksForNoteCarryContextAndAlias() throws Exception {
        note("Target.md", "target");
        note("Source.md", "Intro line\nThis refers to [[target|the target]] inline.");

        List<BacklinkEntry> backlinks = analyzer.getBacklinksForNote(tempDir.toString(), "TARGET");

        assertEquals(1, backlinks.size());
        assertEquals("the target", backlinks.get(0).getAlias());
        assertEquals("Source", backlinks.get(0).getSourceTitle());
        assertEquals("Intro line This refers to [[target|the target]] inline.", backlinks.get(0).getContext());

        NoteGraphStats plain = analyzer.analyzeNoteGraph(tempDir.toString());
        assertNull(plain.getBacklinks().get("Target").get(0).getContext());
    }

    @Test
    void testRepeatedAnalysisIsServedFromCacheWithoutHashing() throws Exception {
        note("A.md", "[[B]]");
        note("B.md", "[[A]]");

        NoteGraphStats first = analyzer.analyzeNoteGraph(tempDir.toString());
        hasher.reset();

        NoteGraphStats second = analyzer.analyzeNoteGraph(tempDir.toString());

        assertSame(first, second);
        assertEquals(0, hasher.getHashCount());
    }

    @Test
    void testContentChangeIsPickedUp() throws Exception {
        Path a = note("A.md", "[[B]]");
        note("B.md", "");

        NoteGraphStats first = analyzer.analyzeNoteGraph(tempDir.toString());
        assertTrue(first.getDanglingLinks().isEmpty());

        Files.writeString(a, "[[B]] [[Nowhere]]");
        Files.setLastModifiedTime(a, FileTime.from(Instant.now().plusSeconds(60)));

        NoteGraphStats second = analyzer.analyzeNoteGraph(tempDir.toString());
        assertNotSame(first, second);
        assertEquals("Nowhere", second.getDanglingLinks().get(0).getTarget());
    }

    @Test
    void testAddedAndRemovedNotesArePickedUp() throws Exception {
        note("A.md", "[[B]]");

        NoteGraphStats first = analyzer.analyzeNoteGraph(tempDir.toString());
        assertEquals(1, first.getDanglingLinks().size());

        note("B.md", "now it exists");
        NoteGraphStats second = analyzer.analyzeNoteGraph(tempDir.toString());
        assertEquals(2, second.getNoteCount());
        assertTrue(second.getDanglingLinks().isEmpty());

        Files.delete(tempDir.resolve("B.md"));
        NoteGraphStats third = analyzer.analyzeNoteGraph(tempDir.toString());
        assertEquals(1, third.getNoteCount());
    }

    @Test
    void testInvalidateGraphCacheDropsEveryShape() throws Exception {
        note("A.md", "[[B]]");
        note("B.md", "");

        NoteGraphStats first = analyzer.analyzeNoteGraph(tempDir.toString());
        analyzer.getBacklinksForNote(tempDir.toString(), "B");
        assertEquals(2, cache.getStats().getCacheSize());

        List<String> removed = analyzer.invalidateGraphCache(tempDir.toString());

        assertEquals(2, removed.size());
        assertTrue(removed.stream().allMatch(key -> key.startsWith("graph-stats:" + tempDir)));
        assertEquals(0, cache.getStats().getCacheSize());
        assertNotSame(first, analyzer.analyzeNoteGraph(tempDir.toString()));
    }

    @Test
    void testCacheCanBeBypassed() throws Exception {
        note("A.md", "[[B]]");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString(),
            AnalyzeOptions.builder().useCache(false).build());

        assertEquals(1, stats.getNoteCount());
        assertEquals(0, cache.getStats().getCacheSize());
    }

    @Test
    void testMissingDirectoryGivesEmptyStats() {
        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.resolve("nope").toString());

        assertEquals(0, stats.getNoteCount());
        assertTrue(stats.getForwardLinks().isEmpty());
        assertTrue(stats.getOrphanNotes().isEmpty());
    }

    @Test
    void testQuickStatsAndCompanionQueries() throws Exception {
        note("A.md", "[[B]] [[Ghost]]");
        note("B.md", "");
        note("C.md", "");

        QuickNoteStats quick = analyzer.getQuickStats(tempDir.toString());

        assertEquals(3, quick.getNoteCount());
        assertEquals(1, quick.getConnectionCount());
        assertEquals(1, quick.getDanglingCount());
        assertEquals(1, quick.getOrphanCount());
        assertEquals(List.of(path("C.md")), analyzer.findOrphanNotes(tempDir.toString()));
    }

    @Test
    void testStatsAreImmutable() throws Exception {
        note("A.md", "[[B]]");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());
        Map<String, List<String>> forwardLinks = stats.getForwardLinks();

        assertThrows(UnsupportedOperationException.class, () -> forwardLinks.put("x", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> stats.getOrphanNotes().clear());
    }

    @Test
    void testRejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class,
            () -> new NoteGraphAnalyzer(new FileSystemNoteWalker(), new MarkdownNoteReader(), cache, 0, 50));
    }

    @Test
    void testInvalidUtf8StillYieldsLinks() throws Exception {
        Files.write(tempDir.resolve("A.md"), "[[B]] café".getBytes(StandardCharsets.ISO_8859_1));
        note("B.md", "plain");

        NoteGraphStats stats = analyzer.analyzeNoteGraph(tempDir.toString());

        assertEquals(1, stats.getTotalMentions());
        assertEquals(1, stats.getBacklinks().get("B").size());
        assertEquals(path("A.md"), stats.getBacklinks().get("B").get(0).getSourcePath());
        assertTrue(stats.getOrphanNotes().isEmpty());
    }

    @Test
    void testNoteSavedAfterReadIsNotServedStale() throws Exception {
        note("A.md", "[[Old]]");

        // Simulates an editor saving the note while the analysis is running
        MarkdownNoteReader savingReader = new MarkdownNoteReader() {
            private final AtomicBoolean saved = new AtomicBoolean();

            @Override
            public MarkdownNote read(Path filePath) throws IOException {
                MarkdownNote note = super.read(filePath);
                if (filePath.getFileName().toString().equals("A.md") && saved.compareAndSet(false, true)) {
                    Files.writeString(filePath, "[[New]]");
                    Files.setLastModifiedTime(filePath, FileTime.from(Instant.now().plusSeconds(60)));
                }
                return note;
            }
        };
        NoteGraphAnalyzer racing = new NoteGraphAnalyzer(new FileSystemNoteWalker(), savingReader, cache, 1, 50);

        try {
            NoteGraphStats first = racing.analyzeNoteGraph(tempDir.toString());
            assertEquals("Old", first.getDanglingLinks().get(0).getTarget());

            NoteGraphStats second = racing.analyzeNoteGraph(tempDir.toString());
            assertNotSame(first, second);
            assertEquals("New", second.getDanglingLinks().get(0).getTarget());
        } finally {
            racing.shutdown();
        }
    }

    @Test
    void testGenerationChangesOnlyWhenRecomputed() throws Exception {
        note("A.md", "[[B]]");

        NoteGraphStats first = analyzer.analyzeNoteGraph(tempDir.toString());
        NoteGraphStats cached = analyzer.analyzeNoteGraph(tempDir.toString());
        assertEquals(first.getGeneration(), cached.getGeneration());

        analyzer.invalidateGraphCache(tempDir.toString());
        NoteGraphStats recomputed = analyzer.analyzeNoteGraph(tempDir.toString());
        assertTrue(recomputed.getGeneration() > first.getGeneration());
    }
}
