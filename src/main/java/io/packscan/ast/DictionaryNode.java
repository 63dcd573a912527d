package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dictionary display with parallel, ordered key and value lists.
 */
public final class DictionaryNode extends Node {

    private final List<Node> keys;
    private final List<Node> values;

    public DictionaryNode(List<? extends Node> keys, List<? extends Node> values) {
        this.keys = mutableCopy(keys);
        this.values = mutableCopy(values);
        if (this.keys.size() != this.values.size()) {
            throw new IllegalArgumentException("keys and values must have the same size: "
                    + this.keys.size() + " != " + this.values.size());
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICTIONARY;
    }

    public List<Node> keys() {
        return Collections.unmodifiableList(keys);
    }

    public List<Node> values() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return keys.size();
    }

    @Override
    public boolean isStatic() {
        return allStatic(keys) && allStatic(values);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(keys.size() * 2);
        addListSlots(slots, keys, this);
        addListSlots(slots, values, this);
        return slots;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("keys", keys.stream().map(Node::toMap).toList());
        data.put("values", values.stream().map(Node::toMap).toList());
        return data;
    }
}
