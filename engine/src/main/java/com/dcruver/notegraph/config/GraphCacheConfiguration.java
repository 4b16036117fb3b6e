package com.dcruver.notegraph.config;

import com.dcruver.notegraph.cache.FileHasher;
import com.dcruver.notegraph.cache.IncrementalCache;
import com.dcruver.notegraph.cache.NoteFileWatcher;
import com.dcruver.notegraph.cache.TypedCache;
import com.dcruver.notegraph.graph.NoteGraphAnalyzer;
import com.dcruver.notegraph.graph.NoteGraphStats;
import com.dcruver.notegraph.io.NotePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Cache instances are explicit objects owned by the application context, one per concern.
 */
@Configuration
@Slf4j
public class GraphCacheConfiguration {

    @Bean
    public FileHasher fileHasher() {
        return new FileHasher();
    }

    @Bean
    public IncrementalCache<NoteGraphStats> graphStatsCache(FileHasher fileHasher, NoteGraphProperties properties) {
        log.info("Graph cache TTL: {}", properties.getCache().getTtl());
        return new IncrementalCache<>(fileHasher, properties.getCache().getTtl(), Clock.systemUTC());
    }

    /**
     * Coarse cache for results derived from a graph snapshot rather than from files.
     */
    @Bean
    public TypedCache typedCache(FileHasher fileHasher, NoteGraphProperties properties) {
        return new TypedCache(new IncrementalCache<>(fileHasher, properties.getCache().getTtl(), Clock.systemUTC()));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "notegraph.watcher.enabled", havingValue = "true")
    public NoteFileWatcher noteFileWatcher(IncrementalCache<NoteGraphStats> graphStatsCache,
                                           NoteGraphAnalyzer analyzer, NoteGraphProperties properties) {
        NoteFileWatcher watcher = new NoteFileWatcher(
            NotePaths.expand(properties.getNotesPath()),
            graphStatsCache,
            analyzer::invalidateGraphCache,
            properties.getWatcher().getDebounce());
        watcher.addListener(event -> log.debug("Notes changed: {} invalidated {}",
            event.getFilePath(), event.getInvalidated()));
        return watcher;
    }
}
