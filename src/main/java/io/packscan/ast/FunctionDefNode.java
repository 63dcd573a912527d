package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Function definition.
 */
public final class FunctionDefNode extends Node {

    private final String name;
    private Node parameters;
    private final List<Node> body;
    private final List<Node> decorators;
    private Node returns;

    public FunctionDefNode(String name,
                           ArgumentsNode parameters,
                           List<? extends Node> body,
                           List<? extends Node> decorators,
                           Node returns) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.body = mutableCopy(body);
        this.decorators = mutableCopy(decorators);
        this.returns = returns;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    public String name() {
        return name;
    }

    /**
     * The parameter declaration. Normally an {@link ArgumentsNode}, though a rewrite may
     * substitute another node.
     */
    public Node parameters() {
        return parameters;
    }

    public List<Node> body() {
        return Collections.unmodifiableList(body);
    }

    public List<Node> decorators() {
        return Collections.unmodifiableList(decorators);
    }

    public Optional<Node> returns() {
        return Optional.ofNullable(returns);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>();
        slots.add(new ChildSlot(parameters, replacement -> {
            parameters = replacement;
            invalidateHash();
        }));
        addListSlots(slots, body, this);
        addListSlots(slots, decorators, this);
        if (returns != null) {
            slots.add(new ChildSlot(returns, replacement -> {
                returns = replacement;
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
        data.put("function_name", name);
        data.put("args", parameters.toMap());
        data.put("body", body.stream().map(Node::toMap).toList());
        data.put("decorator_list", decorators.stream().map(Node::toMap).toList());
        return data;
    }
}
