package io.packscan.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Call expression {@code func(*args, **kwargs)}.
 * <p>
 * Keyword arguments are held as an ordered name to node mapping. A dictionary literal passed
 * as the keyword collection ({@code f(a=1, **{"b": 2})}) is held beside it as a single
 * {@link DictionaryNode}; the signature binder materializes it into ordinary keywords.
 */
public final class CallNode extends Node {

    private Node func;
    private final List<Node> args;
    private final Map<String, Node> kwargs;
    private Node kwargsDictionary;

    public CallNode(Node func, List<? extends Node> args, Map<String, ? extends Node> kwargs) {
        this(func, args, kwargs, null);
    }

    public CallNode(Node func, List<? extends Node> args, DictionaryNode kwargsDictionary) {
        this(func, args, Map.of(), Objects.requireNonNull(kwargsDictionary, "kwargsDictionary"));
    }

    /**
     * Explicit keywords next to a {@code **} dictionary literal. The two are kept apart so a key
     * present in both stays visible to binding.
     */
    public CallNode(Node func,
                    List<? extends Node> args,
                    Map<String, ? extends Node> kwargs,
                    DictionaryNode kwargsDictionary) {
        this.func = Objects.requireNonNull(func, "func");
        this.args = mutableCopy(args);
        this.kwargs = new LinkedHashMap<>();
        if (kwargs != null) {
            kwargs.forEach((name, value) -> this.kwargs.put(
                    Objects.requireNonNull(name, "keyword name"),
                    Objects.requireNonNull(value, "keyword value")));
        }
        this.kwargsDictionary = kwargsDictionary;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    public Node func() {
        return func;
    }

    public List<Node> args() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Keyword arguments written as {@code name=value}.
     */
    public Map<String, Node> kwargs() {
        return Collections.unmodifiableMap(kwargs);
    }

    /**
     * The node passed as the whole keyword collection, if the call site used one.
     */
    public Optional<Node> kwargsDictionary() {
        return Optional.ofNullable(kwargsDictionary);
    }

    /**
     * Explicit name first, then whatever the callee resolves to.
     */
    @Override
    protected String resolveFullName() {
        return func.fullName().orElse(null);
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(args.size() + kwargs.size() + 2);
        addListSlots(slots, args, this);
        addMapSlots(slots, kwargs, this);
        if (kwargsDictionary != null) {
            slots.add(new ChildSlot(kwargsDictionary, replacement -> {
                kwargsDictionary = replacement;
                invalidateHash();
            }));
        }
        slots.add(new ChildSlot(func, replacement -> {
            func = replacement;
            invalidateHash();
        }));
        return slots;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("func", func.toMap());
        data.put("args", args.stream().map(Node::toMap).toList());
        Map<String, Object> keywords = new LinkedHashMap<>();
        kwargs.forEach((name, value) -> keywords.put(name, value.toMap()));
        data.put("kwargs", keywords);
        if (kwargsDictionary != null) {
            data.put("kwargs_dict", kwargsDictionary.toMap());
        }
        return data;
    }

    @Override
    public String toString() {
        return "Call(" + fullName().orElse(String.valueOf(func)) + ")(" + args.size() + " args, "
                + kwargs.keySet() + (kwargsDictionary != null ? " **dict" : "") + ")";
    }
}
