package io.packscan.ast;

import io.packscan.model.Finding;
import io.packscan.model.ScanLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Worklist driven traversal and rewrite engine.
 * <p>
 * A pass starts with one {@link Context} for the root and processes contexts in FIFO order.
 * Every rule registered for the node's kind is presented with the context; afterwards, unless
 * a rule called {@link Context#skipChildren()}, one context per child of whatever node now
 * occupies the slot is queued. Each pass owns its own worklist and modified flag. A node object
 * is visited at most once per pass.
 */
public final class TreeVisitor {

    private static final Logger log = LoggerFactory.getLogger(TreeVisitor.class);

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final List<NodeRule> rules;
    private final Map<NodeKind, List<NodeRule>> dispatch = new EnumMap<>(NodeKind.class);
    private final int maxDepth;

    public TreeVisitor(List<? extends NodeRule> rules) {
        this(rules, DEFAULT_MAX_DEPTH);
    }

    public TreeVisitor(List<? extends NodeRule> rules, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.rules = List.copyOf(rules);
        this.maxDepth = maxDepth;
        for (NodeKind kind : NodeKind.values()) {
            List<NodeRule> forKind = new ArrayList<>();
            for (NodeRule rule : this.rules) {
                if (rule.nodeKinds().isEmpty() || rule.nodeKinds().contains(kind)) {
                    forKind.add(rule);
                }
            }
            dispatch.put(kind, List.copyOf(forKind));
        }
    }

    public List<NodeRule> rules() {
        return rules;
    }

    public TraversalResult traverse(Node root) {
        return traverse(root, null);
    }

    /**
     * Runs a single pass over the tree.
     *
     * @param root     Root node; may itself be replaced by a rule
     * @param location Location the tree was parsed from, made available to rules; may be null
     */
    public TraversalResult traverse(Node root, ScanLocation location) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        Pass pass = new Pass(root, location);
        Queue<Context> worklist = new ArrayDeque<>();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        worklist.add(new Context(root, null, replacement -> pass.root = replacement, 0, pass));

        int processed = 0;
        boolean depthWarned = false;

        while (!worklist.isEmpty()) {
            Context context = worklist.poll();
            Node original = context.node();
            if (!visited.add(original)) {
                continue;
            }
            processed++;

            for (NodeRule rule : dispatch.get(original.kind())) {
                rule.visit(context);
            }

            Node current = context.node();
            if (current != original) {
                visited.add(current);
            }
            if (!context.descends()) {
                continue;
            }
            if (context.depth() >= maxDepth) {
                if (!depthWarned) {
                    log.warn("Tree deeper than {} levels{}, not descending further",
                            maxDepth, location != null ? " in " + location.path() : "");
                    depthWarned = true;
                }
                continue;
            }
            for (ChildSlot slot : current.children()) {
                worklist.add(new Context(slot.node(), context, slot.setter(), context.depth() + 1, pass));
            }
        }

        return new TraversalResult(pass.root, pass.modified, new ArrayList<>(pass.findings), processed, 1);
    }

    /**
     * Repeats passes until one reports no modification or {@code maxPasses} is reached.
     * Findings of all passes are merged by signature.
     */
    public TraversalResult traverseUntilStable(Node root, ScanLocation location, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive: " + maxPasses);
        }
        Node current = root;
        Set<Finding> findings = new LinkedHashSet<>();
        boolean everModified = false;
        boolean stable = false;
        int processed = 0;
        int passes = 0;

        while (passes < maxPasses) {
            TraversalResult result = traverse(current, location);
            passes++;
            processed += result.nodesVisited();
            findings.addAll(result.findings());
            current = result.root();
            if (!result.modified()) {
                stable = true;
                break;
            }
            everModified = true;
        }
        if (!stable) {
            log.debug("Rewrite did not settle within {} passes", maxPasses);
        }
        return new TraversalResult(current, everModified, new ArrayList<>(findings), processed, passes);
    }

    /**
     * Mutable state shared by all contexts of one pass.
     */
    static final class Pass {
        Node root;
        final ScanLocation location;
        boolean modified;
        final Set<Finding> findings = new LinkedHashSet<>();

        Pass(Node root, ScanLocation location) {
            this.root = root;
            this.location = location;
        }
    }
}
