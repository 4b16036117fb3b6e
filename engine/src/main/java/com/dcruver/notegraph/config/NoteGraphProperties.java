package com.dcruver.notegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code notegraph.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "notegraph")
public class NoteGraphProperties {

    /** Default notes directory used by the shell commands. */
    private String notesPath = "${user.home}/notes";

    /** Number of notes read and parsed concurrently during a scan. */
    private int ioConcurrency = 10;

    /** Characters kept on either side of a link in backlink context. */
    private int contextLength = 50;

    /** Backup directory for files rewritten by link merges, relative to the notes directory. */
    private String backupDir = ".notegraph/backups";

    private Cache cache = new Cache();
    private Watcher watcher = new Watcher();
    private Cluster cluster = new Cluster();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Watcher {
        private boolean enabled = false;
        private Duration debounce = Duration.ofMillis(300);
    }

    @Data
    public static class Cluster {
        private double threshold = 0.7;
        private int minClusterSize = 2;
        private int maxResults = 50;
        private int maxTargets = 1000;
    }
}
