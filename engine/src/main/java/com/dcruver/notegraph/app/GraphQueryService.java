package com.dcruver.notegraph.app;

import com.dcruver.notegraph.cache.CacheStats;
import com.dcruver.notegraph.cache.IncrementalCache;
import com.dcruver.notegraph.cache.TypedCache;
import com.dcruver.notegraph.cluster.ClusterOptions;
import com.dcruver.notegraph.cluster.DanglingLinkClusterer;
import com.dcruver.notegraph.cluster.SimilarDanglingLink;
import com.dcruver.notegraph.cluster.SimilarLinkCluster;
import com.dcruver.notegraph.graph.AnalyzeOptions;
import com.dcruver.notegraph.graph.BacklinkEntry;
import com.dcruver.notegraph.graph.DanglingLink;
import com.dcruver.notegraph.graph.NoteGraphAnalyzer;
import com.dcruver.notegraph.graph.NoteGraphStats;
import com.dcruver.notegraph.graph.PageRankCalculator;
import com.dcruver.notegraph.graph.PageRankOptions;
import com.dcruver.notegraph.graph.PageRankResult;
import com.dcruver.notegraph.graph.QuickNoteStats;
import com.dcruver.notegraph.io.LinkMerger;
import com.dcruver.notegraph.io.MergeLinkRequest;
import com.dcruver.notegraph.io.MergeLinkResult;
import com.dcruver.notegraph.io.MergePreview;
import com.dcruver.notegraph.io.NotePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for everything the shell asks about a notes directory.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GraphQueryService {

    static final String PAGERANK_CACHE_TYPE = "pagerank";

    private final NoteGraphAnalyzer analyzer;
    private final DanglingLinkClusterer clusterer;
    private final PageRankCalculator pageRankCalculator;
    private final LinkMerger linkMerger;
    private final TypedCache typedCache;
    private final IncrementalCache<NoteGraphStats> graphStatsCache;

    public NoteGraphStats getStats(String notesDir, boolean includeContext) {
        return analyzer.analyzeNoteGraph(notesDir, AnalyzeOptions.builder()
            .includeContext(includeContext)
            .contextLength(analyzer.getDefaultContextLength())
            .build());
    }

    public List<BacklinkEntry> getBacklinks(String notesDir, String noteTitle) {
        return analyzer.getBacklinksForNote(notesDir, noteTitle);
    }

    /**
     * Titles of the notes a note links to.
     *
     * @param notePath absolute, or relative to the notes directory
     */
    public List<String> getForwardLinks(String notesDir, String notePath) {
        Path dir = NotePaths.expand(notesDir);
        Path note = Path.of(notePath);
        if (!note.isAbsolute()) {
            note = dir.resolve(note);
        }
        List<String> links = analyzer.analyzeNoteGraph(notesDir).getForwardLinks()
            .get(note.normalize().toString());
        return links != null ? links : List.of();
    }

    public List<DanglingLink> getDanglingLinks(String notesDir) {
        return analyzer.findDanglingLinks(notesDir);
    }

    public List<String> getOrphanNotes(String notesDir) {
        return analyzer.findOrphanNotes(notesDir);
    }

    public QuickNoteStats getQuickStats(String notesDir) {
        return analyzer.getQuickStats(notesDir);
    }

    /**
     * Drop cached results for the directory and analyze it again.
     */
    public NoteGraphStats refresh(String notesDir) {
        List<String> removed = analyzer.invalidateGraphCache(notesDir);
        typedCache.invalidateCacheByType(PAGERANK_CACHE_TYPE);
        log.info("Refreshing {} ({} cached results dropped)", notesDir, removed.size());
        return analyzer.analyzeNoteGraph(notesDir);
    }

    public List<SimilarLinkCluster> findSimilarLinkClusters(String notesDir, ClusterOptions options) {
        return clusterer.clusterDanglingLinks(analyzer.findDanglingLinks(notesDir), options);
    }

    public List<SimilarLinkCluster> findSimilarLinkClusters(String notesDir) {
        return findSimilarLinkClusters(notesDir, clusterer.getDefaults());
    }

    public List<SimilarDanglingLink> findSimilarDanglingLinks(String notesDir, String target, double threshold) {
        return clusterer.findSimilarDanglingLinks(target, analyzer.findDanglingLinks(notesDir), threshold);
    }

    /**
     * PageRank of the current graph. The result is reused while the analyzer serves
     * the same stats snapshot.
     */
    public PageRankResult pageRank(String notesDir, PageRankOptions options) {
        NoteGraphStats stats = analyzer.analyzeNoteGraph(notesDir);
        String identifier = NotePaths.expand(notesDir) + "#" + options.getDamping() + "/"
            + options.getIterations() + "/" + options.getTolerance();
        String snapshot = snapshotHash(stats);

        if (typedCache.isCacheValid(PAGERANK_CACHE_TYPE, identifier, snapshot)) {
            PageRankResult cached = typedCache.getCache(PAGERANK_CACHE_TYPE, identifier);
            if (cached != null) {
                log.debug("Reusing PageRank for {}", identifier);
                return cached;
            }
        }

        PageRankResult result = pageRankCalculator.calculate(stats, options);
        typedCache.setCache(PAGERANK_CACHE_TYPE, identifier, result, snapshot);
        return result;
    }

    public PageRankResult pageRank(String notesDir) {
        return pageRank(notesDir, PageRankOptions.defaults());
    }

    public MergeLinkResult mergeLinks(String notesDir, MergeLinkRequest request) {
        MergeLinkResult result = linkMerger.mergeSimilarLinks(notesDir, request);
        if (result.getFilesModified() > 0) {
            typedCache.invalidateCacheByType(PAGERANK_CACHE_TYPE);
        }
        return result;
    }

    public List<MergePreview> previewMerge(String notesDir, MergeLinkRequest request) {
        return linkMerger.previewMerge(notesDir, request);
    }

    public CacheStats cacheStats() {
        return graphStatsCache.getStats();
    }

    private static String snapshotHash(NoteGraphStats stats) {
        return Long.toString(stats.getGeneration());
    }
}
