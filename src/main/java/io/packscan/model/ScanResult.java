package io.packscan.model;

import java.util.Comparator;
import java.util.List;

/**
 * Outcome of a pipeline run.
 *
 * @param findings           Deduplicated findings in the order they were first reported
 * @param locationsScanned   Number of file locations presented to the analyzers
 * @param failedLocations    Number of locations on which an analyzer failed
 * @param skippedLocations   Number of locations dropped for exceeding the nesting limit
 */
public record ScanResult(
        List<Finding> findings,
        int locationsScanned,
        int failedLocations,
        int skippedLocations
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Returns findings with at least the given score, highest score first.
     */
    public List<Finding> findingsAtLeast(int minimumScore) {
        return findings.stream()
                .filter(f -> f.score() >= minimumScore)
                .sorted(Comparator.comparingInt(Finding::score).reversed())
                .toList();
    }

    /**
     * Returns the highest score of any finding, or 0 if there are none.
     */
    public int maxScore() {
        return findings.stream().mapToInt(Finding::score).max().orElse(0);
    }

    public boolean hasFindingsAtLeast(int score) {
        return findings.stream().anyMatch(f -> f.score() >= score);
    }
}
