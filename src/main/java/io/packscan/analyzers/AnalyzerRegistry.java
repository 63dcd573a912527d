package io.packscan.analyzers;

import io.packscan.ScanConfig;
import io.packscan.archive.ArchiveAnalyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Registry of the analyzers the pipeline runs on every location.
 */
public class AnalyzerRegistry {

    private final List<Analyzer> analyzers;

    private AnalyzerRegistry(List<Analyzer> analyzers) {
        this.analyzers = List.copyOf(analyzers);
    }

    /**
     * Creates a registry with all default analyzers.
     */
    public static AnalyzerRegistry createDefault(ScanConfig config) {
        return new AnalyzerRegistry(List.of(
                new ArchiveAnalyzer(config),
                new AstAnalyzer(config)
        ));
    }

    /**
     * Creates a registry with specific analyzers.
     */
    public static AnalyzerRegistry of(Analyzer... analyzers) {
        return new AnalyzerRegistry(Arrays.asList(analyzers));
    }

    /**
     * Returns all registered analyzers.
     */
    public List<Analyzer> allAnalyzers() {
        return analyzers;
    }

    /**
     * Returns an analyzer by ID, if present.
     */
    public Optional<Analyzer> getById(String id) {
        return analyzers.stream()
                .filter(a -> a.id().equals(id))
                .findFirst();
    }
}
