package com.dcruver.notegraph.io;

import com.dcruver.notegraph.cache.FileHasher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Markdown notes and their YAML frontmatter.
 */
@Component
@Slf4j
public class MarkdownNoteReader {

    // Opening "---" line, YAML, closing "---" line, all at the very start of the file
    private static final Pattern FRONTMATTER =
        Pattern.compile("\\A---[ \\t]*\\r?\\n(.*?)(?:\\r?\\n)?^---[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.DOTALL | Pattern.MULTILINE);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Read and parse a note. Invalid UTF-8 sequences decode to U+FFFD.
     *
     * The modification time is taken before reading and the hash is computed over the
     * bytes that were decoded, so a save racing the read can only make the fingerprint
     * look stale, never fresh.
     */
    public MarkdownNote read(Path filePath) throws IOException {
        Instant lastModified = Files.getLastModifiedTime(filePath).toInstant();
        byte[] bytes = Files.readAllBytes(filePath);

        MarkdownNote note = parse(filePath, decode(bytes));
        return note.toBuilder()
            .lastModified(lastModified)
            .contentHash(FileHasher.hash(bytes))
            .build();
    }

    /**
     * Whole file as UTF-8, replacing malformed input instead of failing.
     */
    public static String readContent(Path filePath) throws IOException {
        return decode(Files.readAllBytes(filePath));
    }

    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Parse already loaded content. Malformed frontmatter is treated as absent.
     */
    public MarkdownNote parse(Path filePath, String content) {
        Map<String, Object> frontmatter = Map.of();
        String body = content;

        Matcher matcher = FRONTMATTER.matcher(content);
        if (matcher.find()) {
            body = content.substring(matcher.end());
            frontmatter = parseYaml(filePath, matcher.group(1));
        }

        return MarkdownNote.builder()
            .filePath(filePath)
            .rawContent(content)
            .frontmatter(frontmatter)
            .body(body)
            .build();
    }

    private Map<String, Object> parseYaml(Path filePath, String yaml) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = yamlMapper.readValue(yaml, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed frontmatter in {}: {}", filePath, e.getOriginalMessage());
            return Map.of();
        }
    }
}
