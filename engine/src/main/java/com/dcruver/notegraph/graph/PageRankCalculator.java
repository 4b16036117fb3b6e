package com.dcruver.notegraph.graph;

import com.dcruver.notegraph.io.NotePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks notes by link structure: a note is important when important notes link to it.
 *
 * Power iteration of {@code PR(A) = (1-d)/N + d * sum(PR(T)/C(T))}, where T ranges over
 * the notes linking to A and C(T) is the number of distinct notes T links to.
 */
@Component
@Slf4j
public class PageRankCalculator {

    public PageRankResult calculate(Map<String, List<String>> forwardLinks,
                                    Map<String, List<BacklinkEntry>> backlinks) {
        return calculate(forwardLinks, backlinks, PageRankOptions.defaults(), null);
    }

    public PageRankResult calculate(NoteGraphStats stats, PageRankOptions options) {
        Map<String, String> titleByPath = new HashMap<>();
        for (NoteInfo note : stats.getNotes()) {
            titleByPath.put(note.getPath(), note.getTitle());
        }
        return calculate(stats.getForwardLinks(), stats.getBacklinks(), options, titleByPath);
    }

    /**
     * @param forwardLinks note path to titles of the notes it links to; its keys are the node set
     * @param backlinks    note title to the notes linking to it
     * @param titleByPath  display title per path, may be null to match on file names
     */
    public PageRankResult calculate(Map<String, List<String>> forwardLinks,
                                    Map<String, List<BacklinkEntry>> backlinks,
                                    PageRankOptions options,
                                    Map<String, String> titleByPath) {
        List<String> paths = new ArrayList<>(forwardLinks.keySet());
        int n = paths.size();
        if (n == 0) {
            return PageRankResult.empty();
        }

        Map<String, Integer> indexByPath = new HashMap<>();
        int[] outDegree = new int[n];
        for (int i = 0; i < n; i++) {
            indexByPath.put(paths.get(i), i);
            outDegree[i] = forwardLinks.get(paths.get(i)).size();
        }

        Map<String, List<BacklinkEntry>> incomingByTitle = new HashMap<>();
        backlinks.forEach((title, entries) -> incomingByTitle
            .computeIfAbsent(WikilinkParser.normalizeNoteTitle(title), key -> new ArrayList<>())
            .addAll(entries));

        // Incoming source indices per node, resolved once
        int[][] incoming = new int[n][];
        for (int i = 0; i < n; i++) {
            String path = paths.get(i);
            String title = titleByPath != null ? titleByPath.get(path) : null;
            if (title == null || title.isEmpty()) {
                title = NotePaths.basename(Path.of(path));
            }
            incoming[i] = incomingByTitle.getOrDefault(WikilinkParser.normalizeNoteTitle(title), List.of()).stream()
                .map(entry -> indexByPath.get(entry.getSourcePath()))
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .toArray();
        }

        double damping = options.getDamping();
        double base = (1 - damping) / n;
        double[] scores = new double[n];
        Arrays.fill(scores, 1.0 / n);

        boolean converged = false;
        int iterations = 0;

        while (iterations < options.getIterations()) {
            iterations++;
            double[] next = new double[n];
            double delta = 0;

            for (int i = 0; i < n; i++) {
                double incomingSum = 0;
                for (int source : incoming[i]) {
                    incomingSum += scores[source] / Math.max(1, outDegree[source]);
                }
                next[i] = base + damping * incomingSum;
                delta += Math.abs(next[i] - scores[i]);
            }

            scores = next;
            if (delta < options.getTolerance()) {
                converged = true;
                break;
            }
        }

        double max = 0;
        for (double score : scores) {
            max = Math.max(max, score);
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            normalized.put(paths.get(i), max > 0 ? scores[i] / max : 1.0 / n);
        }

        log.debug("PageRank over {} notes: {} iterations, converged={}", n, iterations, converged);
        return PageRankResult.builder()
            .scores(Collections.unmodifiableMap(normalized))
            .iterations(iterations)
            .converged(converged)
            .build();
    }

    /**
     * Score of one note, 0 when it was not ranked.
     */
    public static double getScore(Map<String, Double> scores, String notePath) {
        return scores.getOrDefault(notePath, 0.0);
    }
}
