package com.dcruver.notegraph.io;

import com.dcruver.notegraph.config.NoteGraphProperties;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Diffs and backups for notes rewritten by link merges.
 */
@Component
@Slf4j
public class LinkPatchWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final String backupDirName;
    private final Clock clock;

    @Autowired
    public LinkPatchWriter(NoteGraphProperties properties) {
        this(properties.getBackupDir(), Clock.systemUTC());
    }

    public LinkPatchWriter(String backupDirName, Clock clock) {
        this.backupDirName = backupDirName;
        this.clock = clock;
    }

    /**
     * Copy a note into the backup directory under the notes directory, keeping its
     * relative path and adding a timestamp.
     *
     * @return the backup file, or null when the original does not exist
     */
    public Path createBackup(Path notesDir, Path originalFile) throws IOException {
        if (!Files.exists(originalFile)) {
            log.warn("Cannot backup non-existent file: {}", originalFile);
            return null;
        }

        Path relative = originalFile.startsWith(notesDir)
            ? notesDir.relativize(originalFile)
            : originalFile.getFileName();
        String timestamp = TIMESTAMP_FORMAT.format(clock.instant());

        Path backupFile = notesDir.resolve(backupDirName).resolve(relative + "." + timestamp + ".bak");
        Files.createDirectories(backupFile.getParent());
        Files.copy(originalFile, backupFile, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Created backup: {}", backupFile);

        return backupFile;
    }

    /**
     * Back up a note, then replace its content.
     */
    public void writeWithBackup(Path notesDir, Path file, String content) throws IOException {
        createBackup(notesDir, file);
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * Unified diff between two versions of a note, three lines of context.
     */
    public String generateDiff(String original, String revised, String fileName) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "original/" + fileName,
            "revised/" + fileName,
            originalLines,
            patch,
            3
        );

        return String.join("\n", unifiedDiff);
    }
}
