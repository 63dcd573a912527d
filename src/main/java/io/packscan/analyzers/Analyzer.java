package io.packscan.analyzers;

import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Base interface for all analyzers run by the scan pipeline.
 * <p>
 * An analyzer produces its output lazily: findings, and child locations for content it
 * unpacked. The returned stream must be closed by the consumer, which releases anything the
 * analyzer opened even if the stream was not fully consumed. Child locations handed out
 * through the stream are owned by the consumer and must be released by it.
 */
public interface Analyzer {

    /**
     * Returns a unique identifier for this analyzer.
     */
    String id();

    /**
     * Returns a human-readable description of what this analyzer finds.
     */
    String description();

    /**
     * Analyzes one location.
     *
     * @param location The location to analyze; its reference stays with the caller
     * @return Findings and child locations, in production order
     * @throws IOException if the location cannot be read at all
     */
    Stream<ScanItem> analyze(ScanLocation location) throws IOException;
}
