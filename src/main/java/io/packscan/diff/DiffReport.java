package io.packscan.diff;

import io.packscan.model.Finding;

import java.util.List;

/**
 * Outcome of a differential scan.
 *
 * @param changes  Every changed file, including those inside unpacked archives
 * @param findings Archive anomalies found on either side, deduplicated by signature
 */
public record DiffReport(List<String> changes, List<Finding> findings) {

    public DiffReport {
        changes = changes == null ? List.of() : List.copyOf(changes);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
