package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Legacy print statement {@code print >>dest, values}.
 */
public final class PrintNode extends Node {

    private final List<Node> values;
    private Node destination;

    public PrintNode(List<? extends Node> values, Node destination) {
        this.values = mutableCopy(values);
        this.destination = destination;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRINT;
    }

    public List<Node> values() {
        return Collections.unmodifiableList(values);
    }

    public Optional<Node> destination() {
        return Optional.ofNullable(destination);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(values.size() + 1);
        addListSlots(slots, values, this);
        if (destination != null) {
            slots.add(new ChildSlot(destination, replacement -> {
                destination = replacement;
                invalidateHash();
            }));
        }
        return slots;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("values", values.stream().map(Node::toMap).toList());
        if (destination != null) {
            data.put("dest", destination.toMap());
        }
        return data;
    }
}
