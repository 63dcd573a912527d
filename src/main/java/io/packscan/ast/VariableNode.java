package io.packscan.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named variable, either a bare name reference or an assignment binding a value.
 */
public final class VariableNode extends Node {

    /**
     * How the variable appears in source.
     */
    public enum Kind {
        /**
         * {@code name = value}
         */
        ASSIGN,

        /**
         * Bare reference to a name.
         */
        NAME
    }

    private final String name;
    private Node value;
    private final Kind variableKind;

    public VariableNode(String name, Node value, Kind variableKind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.value = value;
        this.variableKind = Objects.requireNonNull(variableKind, "variableKind");
    }

    /**
     * Creates a bare name reference.
     */
    public static VariableNode name(String name) {
        return new VariableNode(name, null, Kind.NAME);
    }

    /**
     * Creates an assignment.
     */
    public static VariableNode assign(String name, Node value) {
        return new VariableNode(name, value, Kind.ASSIGN);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    public String name() {
        return name;
    }

    public Optional<Node> value() {
        return Optional.ofNullable(value);
    }

    public Kind variableKind() {
        return variableKind;
    }

    @Override
    protected String resolveFullName() {
        return value != null ? value.fullName().orElse(null) : null;
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(1);
        if (value != null) {
            slots.add(new ChildSlot(value, replacement -> {
                value = replacement;
                invalidateHash();
            }));
        }
        return slots;
    }

    @Override
    protected Object hashKey() {
        return name;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("name", name);
        data.put("var_type", variableKind.name().toLowerCase());
        if (value != null) {
            data.put("value", value.toMap());
        }
        return data;
    }

    @Override
    public String toString() {
        return value != null ? "Var(" + name + " = " + value + ")" : "Var(" + name + ")";
    }
}
