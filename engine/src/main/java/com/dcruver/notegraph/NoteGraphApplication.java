package com.dcruver.notegraph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the note graph engine.
 *
 * Analyzes a directory of Markdown notes linked with [[wikilinks]]: backlinks,
 * forward links, dangling links and orphans, kept cheap to query by a
 * dependency-aware cache, plus fuzzy clustering of dangling link targets.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NoteGraphApplication {

    public static void main(String[] args) {
        log.info("Starting note graph engine...");
        SpringApplication.run(NoteGraphApplication.class, args);
    }
}
