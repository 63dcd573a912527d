package io.packscan.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attribute access {@code source.attr}.
 */
public final class AttributeNode extends Node {

    /**
     * Access kind of the attribute expression.
     */
    public enum Access {
        LOAD,
        STORE,
        DELETE
    }

    private Node source;
    private final String attr;
    private final Access access;

    public AttributeNode(Node source, String attr, Access access) {
        this.source = Objects.requireNonNull(source, "source");
        if (attr == null || attr.isEmpty()) {
            throw new IllegalArgumentException("attr cannot be null or empty");
        }
        this.attr = attr;
        this.access = access != null ? access : Access.LOAD;
    }

    public AttributeNode(Node source, String attr) {
        this(source, attr, Access.LOAD);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    public Node source() {
        return source;
    }

    public String attr() {
        return attr;
    }

    public Access access() {
        return access;
    }

    /**
     * Resolves to {@code module.attr} when the source is an import.
     */
    @Override
    protected String resolveFullName() {
        if (source instanceof ImportNode imported) {
            return imported.module() + "." + attr;
        }
        return null;
    }

    @Override
    List<ChildSlot> children() {
        return List.of(new ChildSlot(source, replacement -> {
            source = replacement;
            invalidateHash();
        }));
    }

    @Override
    protected Object hashKey() {
        return attr;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("source", source.toMap());
        data.put("attr", attr);
        data.put("action", access.name());
        return data;
    }

    @Override
    public String toString() {
        return "Attribute(" + source + " . " + attr + ")";
    }
}
