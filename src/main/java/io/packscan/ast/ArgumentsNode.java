package io.packscan.ast;

import io.packscan.ast.signature.CallSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Formal parameters of a function definition.
 * <p>
 * Positional defaults apply to the trailing positional names, keyword-only defaults are keyed
 * by parameter name.
 */
public final class ArgumentsNode extends Node {

    private final List<String> args;
    private final String vararg;
    private final List<String> kwonlyArgs;
    private final String kwarg;
    private final List<Node> defaults;
    private final Map<String, Node> kwDefaults;

    public ArgumentsNode(List<String> args,
                         String vararg,
                         List<String> kwonlyArgs,
                         String kwarg,
                         List<? extends Node> defaults,
                         Map<String, ? extends Node> kwDefaults) {
        this.args = args != null ? List.copyOf(args) : List.of();
        this.vararg = vararg;
        this.kwonlyArgs = kwonlyArgs != null ? List.copyOf(kwonlyArgs) : List.of();
        this.kwarg = kwarg;
        this.defaults = mutableCopy(defaults);
        this.kwDefaults = new LinkedHashMap<>();
        if (kwDefaults != null) {
            kwDefaults.forEach((name, value) -> {
                if (!this.kwonlyArgs.contains(name)) {
                    throw new IllegalArgumentException("default for unknown keyword-only parameter: " + name);
                }
                this.kwDefaults.put(name, Objects.requireNonNull(value, "default value"));
            });
        }
        if (this.defaults.size() > this.args.size()) {
            throw new IllegalArgumentException("more defaults than positional parameters");
        }
    }

    /**
     * Empty parameter list.
     */
    public static ArgumentsNode empty() {
        return new ArgumentsNode(List.of(), null, List.of(), null, List.of(), Map.of());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENTS;
    }

    public List<String> args() {
        return args;
    }

    public Optional<String> vararg() {
        return Optional.ofNullable(vararg);
    }

    public List<String> kwonlyArgs() {
        return kwonlyArgs;
    }

    public Optional<String> kwarg() {
        return Optional.ofNullable(kwarg);
    }

    public List<Node> defaults() {
        return Collections.unmodifiableList(defaults);
    }

    public Map<String, Node> kwDefaults() {
        return Collections.unmodifiableMap(kwDefaults);
    }

    /**
     * Converts the declaration into a call signature for argument binding.
     */
    public CallSignature toSignature() {
        CallSignature.Builder builder = CallSignature.builder();
        int offset = args.size() - defaults.size();
        for (int i = 0; i < args.size(); i++) {
            if (i >= offset) {
                builder.keyword(args.get(i), defaults.get(i - offset));
            } else {
                builder.positionalOrKeyword(args.get(i));
            }
        }
        if (vararg != null) {
            builder.varPositional(vararg);
        }
        for (String name : kwonlyArgs) {
            if (kwDefaults.containsKey(name)) {
                builder.keywordOnly(name, kwDefaults.get(name));
            } else {
                builder.keywordOnly(name);
            }
        }
        if (kwarg != null) {
            builder.varKeyword(kwarg);
        }
        return builder.build();
    }

    @Override
    List<ChildSlot> children() {
        List<ChildSlot> slots = new ArrayList<>(defaults.size() + kwDefaults.size());
        addListSlots(slots, defaults, this);
        addMapSlots(slots, kwDefaults, this);
        return slots;
    }

    @Override
    protected Object hashKey() {
        return List.of(args, kwonlyArgs);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("args", args);
        data.put("vararg", vararg);
        data.put("kwonlyargs", kwonlyArgs);
        data.put("kwarg", kwarg);
        return data;
    }
}
