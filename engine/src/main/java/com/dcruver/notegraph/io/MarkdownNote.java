package com.dcruver.notegraph.io;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * A Markdown note as read from disk.
 */
@Data
@Builder(toBuilder = true)
public class MarkdownNote {
    private final Path filePath;
    private final String rawContent;

    // YAML frontmatter, empty when absent or malformed
    private final Map<String, Object> frontmatter;

    private final String body;  // content after the frontmatter block

    // Fingerprint of the bytes the content was decoded from, null for parsed-only notes
    private final Instant lastModified;
    private final String contentHash;

    public String getFrontmatterString(String key) {
        Object value = frontmatter != null ? frontmatter.get(key) : null;
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
