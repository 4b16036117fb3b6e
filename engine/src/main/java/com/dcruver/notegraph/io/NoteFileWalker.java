package com.dcruver.notegraph.io;

import java.nio.file.Path;
import java.util.List;

/**
 * Lists the Markdown notes under a directory.
 */
public interface NoteFileWalker {

    /**
     * All {@code .md} files below {@code notesDir}, skipping directories whose name
     * starts with a dot, sorted by path. A missing directory yields an empty list.
     */
    List<Path> listMarkdownFiles(Path notesDir);
}
