package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base of the abstract representation of analyzed source.
 * <p>
 * The set of variants is closed. Every node carries the same metadata: an optional explicit
 * fully qualified name, a source line number, free-form tags, a cached identity hash and a
 * {@link Taint} classification.
 * <p>
 * Child nodes are only ever replaced through the {@link ChildSlot}s returned by
 * {@link #children()}, which are package-private and consumed by {@link TreeVisitor}.
 */
public abstract sealed class Node permits ModuleNode, NumberNode, StringNode, DictionaryNode,
        VariableNode, AttributeNode, CompareNode, FunctionDefNode, CallNode, ArgumentsNode,
        ImportNode, BinaryOpNode, PrintNode {

    private String explicitFullName;
    private int lineNumber = -1;
    private final Set<String> tags = new LinkedHashSet<>();
    private Integer cachedHash;
    private String cachedHashName;
    private Taint taint = Taint.UNKNOWN;

    /**
     * Returns the variant tag of this node.
     */
    public abstract NodeKind kind();

    /**
     * Returns the resolved fully qualified name, if any.
     * An explicitly assigned name wins over the structural resolution of the variant.
     */
    public Optional<String> fullName() {
        if (explicitFullName != null) {
            return Optional.of(explicitFullName);
        }
        return Optional.ofNullable(resolveFullName());
    }

    /**
     * Structural name resolution. Looks at this node and its immediate children only.
     */
    protected String resolveFullName() {
        return null;
    }

    public void setFullName(String fullName) {
        this.explicitFullName = fullName;
        this.cachedHash = null;
    }

    /**
     * True if this node is a literal or a compound of only static children.
     */
    public boolean isStatic() {
        return false;
    }

    /**
     * Direct children with single-slot replace capabilities, in visiting order.
     */
    abstract List<ChildSlot> children();

    public int lineNumber() {
        return lineNumber;
    }

    public void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
        this.cachedHash = null;
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(tags);
    }

    public void addTag(String tag) {
        tags.add(tag);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public Taint taint() {
        return taint;
    }

    public void setTaint(Taint taint) {
        this.taint = Objects.requireNonNull(taint, "taint");
    }

    /**
     * Hash over the node's identifying content, cached until one of its slots is replaced.
     * The full name may change through a replacement anywhere below this node, so the cache is
     * only used while the name it was computed from still resolves the same way.
     */
    public int identityHash() {
        String name = fullName().orElse(null);
        if (cachedHash == null || !Objects.equals(name, cachedHashName)) {
            cachedHash = Objects.hash(kind(), name, lineNumber, hashKey());
            cachedHashName = name;
        }
        return cachedHash;
    }

    /**
     * Variant specific content mixed into {@link #identityHash()}.
     */
    protected Object hashKey() {
        return null;
    }

    protected void invalidateHash() {
        cachedHash = null;
    }

    /**
     * Returns a structured view of the node for reporting and debugging.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> data = new java.util.LinkedHashMap<>();
        data.put("type", kind().name());
        fullName().ifPresent(name -> data.put("full_name", name));
        if (!tags.isEmpty()) {
            data.put("tags", List.copyOf(tags));
        }
        if (lineNumber > 0) {
            data.put("line_no", lineNumber);
        }
        if (taint != Taint.UNKNOWN) {
            data.put("taint", taint.name());
        }
        return data;
    }

    // Slot helpers for subclasses

    static void addListSlots(List<ChildSlot> out, List<Node> list, Node owner) {
        for (int i = 0; i < list.size(); i++) {
            final int index = i;
            out.add(new ChildSlot(list.get(i), replacement -> {
                list.set(index, replacement);
                owner.invalidateHash();
            }));
        }
    }

    static <K> void addMapSlots(List<ChildSlot> out, Map<K, Node> map, Node owner) {
        for (Map.Entry<K, Node> entry : map.entrySet()) {
            final K key = entry.getKey();
            out.add(new ChildSlot(entry.getValue(), replacement -> {
                map.put(key, replacement);
                owner.invalidateHash();
            }));
        }
    }

    static List<Node> mutableCopy(List<? extends Node> nodes) {
        if (nodes == null) {
            return new ArrayList<>();
        }
        List<Node> copy = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            copy.add(Objects.requireNonNull(node, "child node cannot be null"));
        }
        return copy;
    }

    static boolean allStatic(Iterable<Node> nodes) {
        for (Node node : nodes) {
            if (!node.isStatic()) {
                return false;
            }
        }
        return true;
    }
}
