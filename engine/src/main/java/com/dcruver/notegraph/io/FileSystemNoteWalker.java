package com.dcruver.notegraph.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the real file system. Unreadable subdirectories are skipped, the walk continues.
 */
@Component
@Slf4j
public class FileSystemNoteWalker implements NoteFileWalker {

    @Override
    public List<Path> listMarkdownFiles(Path notesDir) {
        List<Path> files = new ArrayList<>();

        if (!Files.isDirectory(notesDir)) {
            log.warn("Notes directory does not exist: {}", notesDir);
            return files;
        }

        try {
            Files.walkFileTree(notesDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(notesDir) && dir.getFileName().toString().startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".md")) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", notesDir, e.getMessage());
        }

        files.sort(null);
        return files;
    }
}
