package com.dcruver.notegraph.io;

import com.dcruver.notegraph.cache.IncrementalCache;
import com.dcruver.notegraph.graph.NoteGraphAnalyzer;
import com.dcruver.notegraph.graph.NoteGraphStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites wikilinks spelled in several ways to one canonical target.
 *
 * Section anchors survive the rewrite. An existing alias is kept; otherwise the old
 * spelling can be kept as the alias so the rendered text does not change.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LinkMerger {

    private final NoteFileWalker walker;
    private final LinkPatchWriter patchWriter;
    private final NoteGraphAnalyzer analyzer;
    private final IncrementalCache<NoteGraphStats> cache;

    /**
     * Pattern matching a wikilink to any of the targets, literally. Group 1 is the
     * target, group 2 the section, group 3 the alias.
     */
    public static Pattern buildReplacementPattern(List<String> targets) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target is required");
        }

        String alternation = targets.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

        return Pattern.compile("\\[\\[(" + alternation + ")(?:#([^\\]|]+))?(?:\\|([^\\]]+))?\\]\\]");
    }

    /**
     * Rewrite one file. The file is backed up and written only when a link was replaced.
     *
     * @return number of links replaced
     */
    public int replaceLinksInFile(Path notesDir, Path file, List<String> oldTargets, String newTarget,
                                  boolean preserveAsAlias) throws IOException {
        String content = MarkdownNoteReader.readContent(file);

        Matcher matcher = buildReplacementPattern(oldTargets).matcher(content);
        int[] count = {0};
        String updated = matcher.replaceAll(match -> {
            count[0]++;
            return Matcher.quoteReplacement(replacement(match, newTarget, preserveAsAlias));
        });

        if (count[0] == 0) {
            return 0;
        }

        patchWriter.writeWithBackup(notesDir, file, updated);
        log.debug("Replaced {} links in {}", count[0], file);
        return count[0];
    }

    /**
     * Rewrite matching links in every note under the directory. A file that fails is
     * recorded in the result's errors and the merge carries on.
     */
    public MergeLinkResult mergeSimilarLinks(String notesDir, MergeLinkRequest request) {
        if (request.getOldTargets().isEmpty()) {
            return MergeLinkResult.builder()
                .modifiedFiles(List.of())
                .errors(Map.of())
                .build();
        }
        validateNewTarget(request);

        Path dir = NotePaths.expand(notesDir);
        analyzer.invalidateGraphCache(dir);

        int linksReplaced = 0;
        List<String> modifiedFiles = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (Path file : walker.listMarkdownFiles(dir)) {
            try {
                int count = replaceLinksInFile(dir, file, request.getOldTargets(), request.getNewTarget(),
                    request.isPreserveAsAlias());
                if (count > 0) {
                    linksReplaced += count;
                    modifiedFiles.add(file.toString());
                }
            } catch (IOException e) {
                log.warn("Failed to merge links in {}: {}", file, e.getMessage());
                errors.put(file.toString(), e.getMessage());
            }
        }

        if (!modifiedFiles.isEmpty()) {
            analyzer.invalidateGraphCache(dir);
            modifiedFiles.forEach(cache::invalidateByFile);
        }

        log.info("Merged {} into [[{}]]: {} links in {} files, {} errors",
            request.getOldTargets(), request.getNewTarget(), linksReplaced, modifiedFiles.size(), errors.size());

        return MergeLinkResult.builder()
            .filesModified(modifiedFiles.size())
            .linksReplaced(linksReplaced)
            .modifiedFiles(List.copyOf(modifiedFiles))
            .errors(errors)
            .build();
    }

    /**
     * What {@link #mergeSimilarLinks} would change, without writing anything.
     * Files that cannot be read are skipped.
     */
    public List<MergePreview> previewMerge(String notesDir, MergeLinkRequest request) {
        if (request.getOldTargets().isEmpty()) {
            return List.of();
        }
        validateNewTarget(request);

        Path dir = NotePaths.expand(notesDir);
        Pattern pattern = buildReplacementPattern(request.getOldTargets());
        List<MergePreview> previews = new ArrayList<>();

        for (Path file : walker.listMarkdownFiles(dir)) {
            String content;
            try {
                content = MarkdownNoteReader.readContent(file);
            } catch (IOException e) {
                log.warn("Skipping {} in merge preview: {}", file, e.getMessage());
                continue;
            }

            List<MergePreview.Match> matches = new ArrayList<>();
            String[] lines = content.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                Matcher matcher = pattern.matcher(lines[i]);
                while (matcher.find()) {
                    matches.add(MergePreview.Match.builder()
                        .original(matcher.group())
                        .replaced(replacement(matcher, request.getNewTarget(), request.isPreserveAsAlias()))
                        .line(i + 1)
                        .build());
                }
            }

            if (matches.isEmpty()) {
                continue;
            }

            String updated = pattern.matcher(content).replaceAll(match ->
                Matcher.quoteReplacement(replacement(match, request.getNewTarget(), request.isPreserveAsAlias())));

            previews.add(MergePreview.builder()
                .filePath(file.toString())
                .matches(List.copyOf(matches))
                .diff(patchWriter.generateDiff(content, updated, dir.relativize(file).toString()))
                .build());
        }

        return previews;
    }

    static String replacement(MatchResult match, String newTarget, boolean preserveAsAlias) {
        String originalTarget = match.group(1);
        String section = match.group(2);
        String existingAlias = match.group(3);

        StringBuilder link = new StringBuilder("[[").append(newTarget);
        if (section != null) {
            link.append('#').append(section);
        }
        if (existingAlias != null) {
            link.append('|').append(existingAlias);
        } else if (preserveAsAlias && !originalTarget.equals(newTarget)) {
            link.append('|').append(originalTarget);
        }
        return link.append("]]").toString();
    }

    private static void validateNewTarget(MergeLinkRequest request) {
        if (request.getNewTarget() == null || request.getNewTarget().isBlank()) {
            throw new IllegalArgumentException("newTarget must not be blank");
        }
    }
}
