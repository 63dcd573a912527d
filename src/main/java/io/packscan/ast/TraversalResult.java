package io.packscan.ast;

import io.packscan.model.Finding;

import java.util.List;

/**
 * Outcome of one or more traversal passes.
 *
 * @param root         Current root; differs from the input root if a rule replaced it
 * @param modified     True if any pass replaced a node or otherwise marked the tree modified
 * @param findings     Findings reported by rules, deduplicated by signature, in report order
 * @param nodesVisited Number of contexts processed over all passes
 * @param passes       Number of passes run
 */
public record TraversalResult(
        Node root,
        boolean modified,
        List<Finding> findings,
        int nodesVisited,
        int passes
) {
    public TraversalResult {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        findings = findings != null ? List.copyOf(findings) : List.of();
    }
}
