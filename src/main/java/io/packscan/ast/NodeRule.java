package io.packscan.ast;

import java.util.Set;

/**
 * A rule presented with tree nodes by the {@link TreeVisitor}.
 * Rules may inspect the node, report findings, replace the node in its slot, or opt out of
 * descending into its children.
 */
public interface NodeRule {

    /**
     * Returns a unique identifier for this rule.
     */
    String id();

    /**
     * Node kinds this rule reacts to. An empty set means every kind.
     */
    Set<NodeKind> nodeKinds();

    /**
     * Visits one node of the current pass.
     *
     * @param context The node together with its slot capabilities and the traversal state
     */
    void visit(Context context);
}
