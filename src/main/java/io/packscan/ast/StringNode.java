package io.packscan.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * String literal.
 */
public final class StringNode extends Node {

    private final String value;

    public StringNode(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }

    public String value() {
        return value;
    }

    @Override
    public boolean isStatic() {
        return true;
    }

    @Override
    List<ChildSlot> children() {
        return List.of();
    }

    @Override
    protected Object hashKey() {
        return value;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("value", value);
        return data;
    }

    @Override
    public String toString() {
        return "String(" + value + ")";
    }
}
