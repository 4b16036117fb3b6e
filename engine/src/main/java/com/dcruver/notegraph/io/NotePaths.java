package com.dcruver.notegraph.io;

import java.nio.file.Path;

/**
 * Path helpers shared by the analyzer, merger and shell.
 */
public final class NotePaths {

    private NotePaths() {
    }

    /**
     * Expand {@code ~} and {@code ${user.home}}, then make the path absolute and normalized.
     */
    public static Path expand(String path) {
        String home = System.getProperty("user.home");
        String expanded = path.replace("${user.home}", home);
        if (expanded.equals("~")) {
            expanded = home;
        } else if (expanded.startsWith("~/")) {
            expanded = home + expanded.substring(1);
        }
        return Path.of(expanded).toAbsolutePath().normalize();
    }

    /**
     * File name without the {@code .md} extension.
     */
    public static String basename(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".md") ? name.substring(0, name.length() - 3) : name;
    }
}
