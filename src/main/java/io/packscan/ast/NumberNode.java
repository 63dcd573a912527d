package io.packscan.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Numeric literal.
 */
public final class NumberNode extends Node {

    private final Number value;

    public NumberNode(Number value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NUMBER;
    }

    public Number value() {
        return value;
    }

    /**
     * True for integer literals (as opposed to floating point ones).
     */
    public boolean isIntegral() {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
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
        return "Number(" + value + ")";
    }
}
