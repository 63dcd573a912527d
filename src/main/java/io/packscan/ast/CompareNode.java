package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Comparison chain {@code left op1 c1 op2 c2 ...}.
 */
public final class CompareNode extends Node {

    private Node left;
    private final List<String> operators;
    private final List<Node> comparators;

    public CompareNode(Node left, List<String> operators, List<? extends Node> comparators) {
        this.left = Objects.requireNonNull(left, "left");
        this.operators = operators != null ? List.copyOf(operators) : List.of();
        this.comparators = mutableCopy(comparators);
        if (this.operators.size() != this.comparators.size()) {
            throw new IllegalArgumentException("every comparator needs exactly one operator");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARE;
    }

    public Node left() {
        return left;
    }

    public List<String> operators() {
        return operators;
    }

    public List<Node> comparators() {
        return Collections.unmodifiableList(comparators);
    }

    @Override
    public boolean isStatic() {
        return left.isStatic() && allStatic(comparators);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(comparators.size() + 1);
        slots.add(new ChildSlot(left, replacement -> {
            left = replacement;
            invalidateHash();
        }));
        addListSlots(slots, comparators, this);
        return slots;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("left", left.toMap());
        data.put("ops", operators);
        data.put("comparators", comparators.stream().map(Node::toMap).toList());
        return data;
    }
}
