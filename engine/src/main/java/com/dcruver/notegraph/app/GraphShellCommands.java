package com.dcruver.notegraph.app;

import com.dcruver.notegraph.cache.CacheStats;
import com.dcruver.notegraph.cluster.ClusterOptions;
import com.dcruver.notegraph.cluster.SimilarDanglingLink;
import com.dcruver.notegraph.cluster.SimilarLinkCluster;
import com.dcruver.notegraph.cluster.SimilarLinkMember;
import com.dcruver.notegraph.config.NoteGraphProperties;
import com.dcruver.notegraph.graph.BacklinkEntry;
import com.dcruver.notegraph.graph.DanglingLink;
import com.dcruver.notegraph.graph.NoteGraphStats;
import com.dcruver.notegraph.graph.PageRankResult;
import com.dcruver.notegraph.io.MergeLinkRequest;
import com.dcruver.notegraph.io.MergeLinkResult;
import com.dcruver.notegraph.io.MergePreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Spring Shell commands for inspecting and repairing the note graph.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GraphShellCommands {

    private final GraphQueryService queryService;
    private final GraphJsonWriter jsonWriter;
    private final NoteGraphProperties properties;

    @ShellMethod(key = "graph-stats", value = "Show link statistics for the notes directory")
    public String graphStats(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir,
        @ShellOption(defaultValue = "false", help = "Print the full stats as JSON") boolean json
    ) {
        try {
            NoteGraphStats stats = queryService.getStats(notesDir(dir), false);
            if (json) {
                return jsonWriter.toJson(stats);
            }

            StringBuilder result = new StringBuilder();
            result.append("Note graph:\n");
            result.append(String.format("- Notes: %d\n", stats.getNoteCount()));
            result.append(String.format("- Unique connections: %d\n", stats.getUniqueConnections()));
            result.append(String.format("- Wikilink mentions: %d\n", stats.getTotalMentions()));
            result.append(String.format("- Dangling targets: %d\n", stats.getDanglingLinks().size()));
            result.append(String.format("- Orphan notes: %d\n", stats.getOrphanNotes().size()));
            return result.toString();

        } catch (Exception e) {
            log.error("Graph stats failed", e);
            return "Graph stats failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "backlinks", value = "List notes linking to a note")
    public String backlinks(
        @ShellOption(help = "Note title") String title,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir
    ) {
        try {
            List<BacklinkEntry> entries = queryService.getBacklinks(notesDir(dir), title);
            if (entries.isEmpty()) {
                return "No backlinks to " + title;
            }

            StringBuilder result = new StringBuilder();
            result.append(String.format("%d notes link to %s:\n\n", entries.size(), title));
            for (BacklinkEntry entry : entries) {
                result.append(String.format("- %s (%s)\n", entry.getSourceTitle(), entry.getSourcePath()));
                if (entry.getContext() != null) {
                    result.append("    ").append(entry.getContext()).append("\n");
                }
            }
            return result.toString();

        } catch (Exception e) {
            log.error("Backlinks failed", e);
            return "Backlinks failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "dangling", value = "List link targets that match no note")
    public String dangling(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir,
        @ShellOption(defaultValue = "20", help = "Maximum targets to show") int limit
    ) {
        try {
            List<DanglingLink> links = queryService.getDanglingLinks(notesDir(dir));
            if (links.isEmpty()) {
                return "No dangling links.";
            }

            StringBuilder result = new StringBuilder();
            result.append(String.format("%d dangling targets:\n\n", links.size()));
            links.stream()
                .sorted((a, b) -> Integer.compare(b.getTotalOccurrences(), a.getTotalOccurrences()))
                .limit(limit)
                .forEach(link -> result.append(String.format("- [[%s]] x%d in %d notes\n",
                    link.getTarget(), link.getTotalOccurrences(), link.getSources().size())));
            return result.toString();

        } catch (Exception e) {
            log.error("Dangling link listing failed", e);
            return "Dangling link listing failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "orphans", value = "List notes with no links in or out")
    public String orphans(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir
    ) {
        try {
            List<String> orphans = queryService.getOrphanNotes(notesDir(dir));
            if (orphans.isEmpty()) {
                return "No orphan notes.";
            }
            return String.format("%d orphan notes:\n\n", orphans.size())
                + String.join("\n", orphans.stream().map(path -> "- " + path).toList());

        } catch (Exception e) {
            log.error("Orphan listing failed", e);
            return "Orphan listing failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "similar-links", value = "Group dangling links spelled alike")
    public String similarLinks(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir,
        @ShellOption(defaultValue = "0.7", help = "Similarity threshold in [0, 1]") double threshold,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Only find targets similar to this one") String target,
        @ShellOption(defaultValue = "false", help = "Cluster every dangling target, however many") boolean all
    ) {
        try {
            if (target != null) {
                List<SimilarDanglingLink> similar = queryService.findSimilarDanglingLinks(notesDir(dir), target, threshold);
                if (similar.isEmpty()) {
                    return "No dangling links similar to " + target;
                }
                StringBuilder result = new StringBuilder();
                for (SimilarDanglingLink link : similar) {
                    result.append(String.format("- [[%s]] %.2f (x%d)\n",
                        link.getDanglingLink().getTarget(), link.getSimilarity().getScore(),
                        link.getDanglingLink().getTotalOccurrences()));
                }
                return result.toString();
            }

            ClusterOptions options = ClusterOptions.builder()
                .threshold(threshold)
                .minClusterSize(properties.getCluster().getMinClusterSize())
                .maxResults(properties.getCluster().getMaxResults())
                .maxTargets(properties.getCluster().getMaxTargets())
                .allowLargeInput(all)
                .build();
            List<SimilarLinkCluster> clusters = queryService.findSimilarLinkClusters(notesDir(dir), options);
            if (clusters.isEmpty()) {
                return "No similar dangling links found.";
            }

            StringBuilder result = new StringBuilder();
            result.append(String.format("%d clusters:\n\n", clusters.size()));
            for (SimilarLinkCluster cluster : clusters) {
                result.append(String.format("[[%s]] x%d, avg similarity %.2f\n",
                    cluster.getRepresentativeTarget(), cluster.getTotalOccurrences(), cluster.getAverageSimilarity()));
                for (SimilarLinkMember member : cluster.getMembers().subList(1, cluster.size())) {
                    result.append(String.format("    [[%s]] %.2f\n", member.getTarget(), member.getSimilarity()));
                }
            }
            result.append("\nRun 'merge-links --targets a,b --into c' to merge a cluster.\n");
            return result.toString();

        } catch (Exception e) {
            log.error("Similar link search failed", e);
            return "Similar link search failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "merge-links", value = "Rewrite links to several targets into one target")
    public String mergeLinks(
        @ShellOption(help = "Comma-separated link targets to replace") String targets,
        @ShellOption(help = "Canonical target") String into,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir,
        @ShellOption(value = "--preserve-alias", defaultValue = "false", help = "Keep the old spelling as the link alias") boolean preserveAlias,
        @ShellOption(defaultValue = "false", help = "Show the changes without writing") boolean preview
    ) {
        try {
            MergeLinkRequest request = MergeLinkRequest.builder()
                .oldTargets(Arrays.stream(targets.split(","))
                    .map(String::trim)
                    .filter(t -> !t.isEmpty())
                    .toList())
                .newTarget(into)
                .preserveAsAlias(preserveAlias)
                .build();

            if (preview) {
                List<MergePreview> previews = queryService.previewMerge(notesDir(dir), request);
                if (previews.isEmpty()) {
                    return "No matching links.";
                }
                StringBuilder result = new StringBuilder();
                for (MergePreview filePreview : previews) {
                    result.append(String.format("%s (%d links)\n", filePreview.getFilePath(),
                        filePreview.getMatches().size()));
                    result.append(filePreview.getDiff()).append("\n\n");
                }
                return result.toString();
            }

            MergeLinkResult result = queryService.mergeLinks(notesDir(dir), request);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Replaced %d links in %d files.\n", result.getLinksReplaced(), result.getFilesModified()));
            for (Map.Entry<String, String> error : result.getErrors().entrySet()) {
                sb.append(String.format("  failed: %s: %s\n", error.getKey(), error.getValue()));
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Link merge failed", e);
            return "Link merge failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "pagerank", value = "Rank notes by link importance")
    public String pageRank(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir,
        @ShellOption(defaultValue = "10", help = "Number of notes to show") int top
    ) {
        try {
            PageRankResult result = queryService.pageRank(notesDir(dir));
            if (result.getScores().isEmpty()) {
                return "No notes.";
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("PageRank (%d iterations%s):\n\n", result.getIterations(),
                result.isConverged() ? ", converged" : ""));
            result.getScores().entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(top)
                .forEach(entry -> sb.append(String.format("%.3f  %s\n", entry.getValue(), entry.getKey())));
            return sb.toString();

        } catch (Exception e) {
            log.error("PageRank failed", e);
            return "PageRank failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph-refresh", value = "Drop cached results and rescan the notes directory")
    public String refresh(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String dir
    ) {
        try {
            NoteGraphStats stats = queryService.refresh(notesDir(dir));
            return String.format("Rescanned %d notes.", stats.getNoteCount());

        } catch (Exception e) {
            log.error("Refresh failed", e);
            return "Refresh failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cache-stats", value = "Show graph cache statistics")
    public String cacheStats() {
        try {
            CacheStats stats = queryService.cacheStats();
            StringBuilder result = new StringBuilder();
            result.append(String.format("Cached results: %d\n", stats.getCacheSize()));
            result.append(String.format("Memoized file hashes: %d\n", stats.getFileHashCacheSize()));
            result.append(String.format("Tracked files: %d\n", stats.getTrackedFiles()));
            stats.getKeys().forEach(key -> result.append("- ").append(key).append("\n"));
            return result.toString();

        } catch (Exception e) {
            log.error("Cache stats failed", e);
            return "Cache stats failed: " + e.getMessage();
        }
    }

    private String notesDir(String dir) {
        return dir != null ? dir : properties.getNotesPath();
    }
}
