package io.packscan.analysis;

import io.packscan.ScanConfig;
import io.packscan.analyzers.Analyzer;
import io.packscan.analyzers.AnalyzerRegistry;
import io.packscan.model.ContentType;
import io.packscan.model.Finding;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;
import io.packscan.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Drives analyzers over a queue of scan locations.
 * <p>
 * Directories are expanded into one location per regular file. Every file location is offered
 * to every analyzer; child locations they produce are queued for the same treatment unless
 * they are nested deeper than the configured maximum. Findings are deduplicated by signature.
 * A failing analyzer only affects the location it failed on. Each location is released once
 * it has been processed, which deletes extraction directories as soon as nothing refers to
 * them anymore.
 */
public class ScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    private final ScanConfig config;
    private final AnalyzerRegistry registry;

    public ScanPipeline(ScanConfig config) {
        this(config, AnalyzerRegistry.createDefault(config));
    }

    public ScanPipeline(ScanConfig config, AnalyzerRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * Scans a file or directory.
     */
    public ScanResult scan(Path path) {
        return scan(ScanLocation.of(path), finding -> { });
    }

    /**
     * Scans a location, passing every new finding to {@code sink} as soon as it is produced.
     * The pipeline takes over the caller's reference to {@code root} and releases it.
     */
    public ScanResult scan(ScanLocation root, Consumer<Finding> sink) {
        Set<Finding> findings = new LinkedHashSet<>();
        Queue<ScanLocation> queue = new LinkedList<>();
        queue.add(root);

        int scanned = 0;
        int failed = 0;
        int skipped = 0;

        while (!queue.isEmpty()) {
            ScanLocation location = queue.poll();
            try {
                if (location.contentType() == ContentType.DIRECTORY) {
                    if (!expand(location, queue)) {
                        failed++;
                    }
                    continue;
                }
                scanned++;
                boolean ok = true;
                for (Analyzer analyzer : registry.allAnalyzers()) {
                    try {
                        skipped += run(analyzer, location, queue, findings, sink);
                    } catch (IOException | RuntimeException e) {
                        log.error("Analyzer '{}' failed on {}", analyzer.id(), location.path(), e);
                        ok = false;
                    }
                }
                if (!ok) {
                    failed++;
                }
            } finally {
                location.release();
            }
        }

        return new ScanResult(new ArrayList<>(findings), scanned, failed, skipped);
    }

    /**
     * Runs one analyzer and routes its output. Returns the number of child locations dropped
     * for exceeding the nesting limit.
     */
    private int run(Analyzer analyzer,
                    ScanLocation location,
                    Queue<ScanLocation> queue,
                    Set<Finding> findings,
                    Consumer<Finding> sink) throws IOException {
        int dropped = 0;
        try (Stream<ScanItem> items = analyzer.analyze(location)) {
            Iterator<ScanItem> iterator = items.iterator();
            while (iterator.hasNext()) {
                ScanItem item = iterator.next();
                if (item instanceof Finding finding) {
                    if (findings.add(finding)) {
                        sink.accept(finding);
                    }
                } else if (item instanceof ScanLocation child) {
                    if (child.depth() > config.maxDepth()) {
                        log.warn("Not scanning {} from {}: nesting depth {} exceeds the maximum of {}",
                                child.path(), location.path(), child.depth(), config.maxDepth());
                        child.release();
                        dropped++;
                    } else {
                        queue.add(child);
                    }
                }
            }
        }
        return dropped;
    }

    /**
     * Queues one child location per regular file below the directory, in path order.
     */
    private boolean expand(ScanLocation directory, Queue<ScanLocation> queue) {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory.path())) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException | UncheckedIOException e) {
            log.error("Cannot list directory {}", directory.path(), e);
            return false;
        }
        for (Path file : files) {
            queue.add(directory.createChild(file, false));
        }
        log.debug("Expanded {} into {} files", directory.path(), files.size());
        return true;
    }
}
