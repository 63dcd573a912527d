package io.packscan.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Binary operation {@code left op right}.
 */
public final class BinaryOpNode extends Node {

    private final String operator;
    private Node left;
    private Node right;

    public BinaryOpNode(String operator, Node left, Node right) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator cannot be null or blank");
        }
        this.operator = operator;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    public String operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public boolean isStatic() {
        return left.isStatic() && right.isStatic();
    }

    @Override
    List<ChildSlot> children() {
        return List.of(
                new ChildSlot(left, replacement -> {
                    left = replacement;
                    invalidateHash();
                }),
                new ChildSlot(right, replacement -> {
                    right = replacement;
                    invalidateHash();
                }));
    }

    @Override
    protected Object hashKey() {
        return operator;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("op", operator);
        data.put("left", left.toMap());
        data.put("right", right.toMap());
        return data;
    }
}
