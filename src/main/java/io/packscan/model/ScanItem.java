package io.packscan.model;

/**
 * One element produced by an analyzer: either a detection or a new location to scan.
 */
public sealed interface ScanItem permits Finding, ScanLocation {
}
