package com.dcruver.notegraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and compares [[wikilinks]] in Markdown content.
 *
 * Supported shapes: {@code [[target]]}, {@code [[target|alias]]},
 * {@code [[target#section]]} and {@code [[target#section|alias]]}.
 * Links never span lines; unterminated brackets are simply not matched.
 */
public final class WikilinkParser {

    public static final int DEFAULT_CONTEXT_LENGTH = 50;

    private static final Pattern WIKILINK =
        Pattern.compile("\\[\\[([^\\]|#]+)(?:#([^\\]|]+))?(?:\\|([^\\]]+))?\\]\\]");

    private static final Pattern MD_EXTENSION = Pattern.compile("\\.md$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATORS = Pattern.compile("[-_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NEWLINES = Pattern.compile("\\n+");

    private static final String ELLIPSIS = "...";

    private WikilinkParser() {
    }

    /**
     * Parse every wikilink in the content with its position.
     *
     * @param content Markdown content
     * @return links in document order
     */
    public static List<Wikilink> parseWikilinks(String content) {
        List<Wikilink> results = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return results;
        }

        String[] lines = content.split("\n", -1);
        int lineOffset = 0;

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum];
            Matcher matcher = WIKILINK.matcher(line);

            while (matcher.find()) {
                String target = matcher.group(1).trim();
                if (target.isEmpty()) {
                    continue;
                }

                int start = lineOffset + matcher.start();
                String raw = matcher.group();

                results.add(Wikilink.builder()
                    .raw(raw)
                    .target(target)
                    .section(trimToNull(matcher.group(2)))
                    .alias(trimToNull(matcher.group(3)))
                    .position(Wikilink.Position.builder()
                        .start(start)
                        .end(start + raw.length())
                        .line(lineNum)
                        .build())
                    .build());
            }

            lineOffset += line.length() + 1;
        }

        return results;
    }

    /**
     * Unique link targets in order of first appearance.
     */
    public static List<String> extractWikilinks(String content) {
        Set<String> targets = new LinkedHashSet<>();
        for (Wikilink link : parseWikilinks(content)) {
            targets.add(link.getTarget());
        }
        return new ArrayList<>(targets);
    }

    /**
     * Total number of wikilinks, duplicates included.
     */
    public static int countWikilinkMentions(String content) {
        return parseWikilinks(content).size();
    }

    /**
     * Links whose target is the same note as {@code targetNote} after normalization.
     */
    public static List<Wikilink> findLinksToNote(String content, String targetNote) {
        String normalizedTarget = normalizeNoteTitle(targetNote);
        return parseWikilinks(content).stream()
            .filter(link -> normalizeNoteTitle(link.getTarget()).equals(normalizedTarget))
            .toList();
    }

    /**
     * Text around a link for display in backlink listings.
     * Truncated ends are marked with an ellipsis and newlines collapse to a space.
     *
     * @param content       content the link was parsed from
     * @param link          the link
     * @param contextLength characters to keep on each side
     */
    public static String extractContext(String content, Wikilink link, int contextLength) {
        int start = Math.max(0, link.getPosition().getStart() - contextLength);
        int end = Math.min(content.length(), link.getPosition().getEnd() + contextLength);

        String context = content.substring(start, end);

        if (start > 0) {
            context = ELLIPSIS + context.stripLeading();
        }
        if (end < content.length()) {
            context = context.stripTrailing() + ELLIPSIS;
        }

        return NEWLINES.matcher(context).replaceAll(" ").trim();
    }

    public static String extractContext(String content, Wikilink link) {
        return extractContext(content, link, DEFAULT_CONTEXT_LENGTH);
    }

    /**
     * Canonical form of a note title or file name used for every title comparison:
     * lowercase, trimmed, no {@code .md} suffix, dashes and underscores as spaces,
     * single spaces.
     */
    public static String normalizeNoteTitle(String title) {
        if (title == null) {
            return "";
        }
        String normalized = title.toLowerCase(Locale.ROOT).trim();
        normalized = MD_EXTENSION.matcher(normalized).replaceAll("");
        normalized = SEPARATORS.matcher(normalized).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ");
    }

    public static boolean isSameNote(String title1, String title2) {
        return normalizeNoteTitle(title1).equals(normalizeNoteTitle(title2));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
