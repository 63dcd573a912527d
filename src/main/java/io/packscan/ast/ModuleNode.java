package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed source file: an ordered list of top-level statements.
 */
public final class ModuleNode extends Node {

    private final List<Node> body;

    public ModuleNode(List<? extends Node> body) {
        this.body = mutableCopy(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE;
    }

    public List<Node> body() {
        return Collections.unmodifiableList(body);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(body.size());
        addListSlots(slots, body, this);
        return slots;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("body", body.stream().map(Node::toMap).toList());
        return data;
    }
}
