package io.packscan.ast;

import io.packscan.model.Finding;
import io.packscan.model.ScanLocation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A node as presented to rules during one traversal pass.
 * <p>
 * Contexts are created by the {@link TreeVisitor} only. {@link #replace(Node)} overwrites
 * exactly the slot the node occupies in its parent and marks the pass as modified.
 */
public final class Context {

    private Node node;
    private final Context parent;
    private final Consumer<Node> replacer;
    private final int depth;
    private final TreeVisitor.Pass pass;
    private boolean descend = true;

    Context(Node node, Context parent, Consumer<Node> replacer, int depth, TreeVisitor.Pass pass) {
        this.node = node;
        this.parent = parent;
        this.replacer = replacer;
        this.depth = depth;
        this.pass = pass;
    }

    /**
     * The node currently occupying this context's slot.
     */
    public Node node() {
        return node;
    }

    public Optional<Context> parent() {
        return Optional.ofNullable(parent);
    }

    public int depth() {
        return depth;
    }

    /**
     * The location whose source is being traversed, if the traversal was given one.
     */
    public Optional<ScanLocation> location() {
        return Optional.ofNullable(pass.location);
    }

    /**
     * Substitutes a new node in this slot. Children of the replacement are traversed in the
     * same pass unless {@link #skipChildren()} is called.
     */
    public void replace(Node replacement) {
        Objects.requireNonNull(replacement, "replacement");
        replacer.accept(replacement);
        node = replacement;
        pass.modified = true;
    }

    public void report(Finding finding) {
        pass.findings.add(Objects.requireNonNull(finding, "finding"));
    }

    /**
     * Marks the pass modified without a structural replacement, e.g. after a metadata change
     * that other rules depend on.
     */
    public void markModified() {
        pass.modified = true;
    }

    public boolean isModified() {
        return pass.modified;
    }

    /**
     * Do not push the children of this node onto the worklist.
     */
    public void skipChildren() {
        descend = false;
    }

    boolean descends() {
        return descend;
    }

    @Override
    public String toString() {
        return "Context(" + node + ", depth=" + depth + ")";
    }
}
