package io.packscan.ast.signature;

import io.packscan.ast.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a successful binding: every parameter of the signature mapped to a value.
 * <p>
 * Values are the call's argument {@link Node}s, a parameter's default value for omitted
 * parameters (which may be {@code null}), a {@code List<Node>} for a var-positional parameter
 * and a {@code Map<String, Node>} for a var-keyword parameter.
 */
public final class BoundArguments {

    private final CallSignature signature;
    private final Map<String, Object> arguments;
    private final Map<String, Boolean> defaulted;

    BoundArguments(CallSignature signature, Map<String, Object> arguments, Map<String, Boolean> defaulted) {
        this.signature = signature;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.defaulted = Map.copyOf(defaulted);
    }

    public CallSignature signature() {
        return signature;
    }

    /**
     * All bound values in parameter order. Values may be {@code null}.
     */
    public Map<String, Object> arguments() {
        return arguments;
    }

    /**
     * Bound value of a parameter; {@code null} if the parameter is unknown or bound to a
     * {@code null} default.
     */
    public Object get(String name) {
        return arguments.get(name);
    }

    /**
     * Bound value of a parameter if it is a node supplied at the call site.
     */
    public Optional<Node> node(String name) {
        Object value = arguments.get(name);
        return value instanceof Node node ? Optional.of(node) : Optional.empty();
    }

    /**
     * True if the parameter was omitted at the call site and took its default.
     */
    public boolean isDefaulted(String name) {
        return defaulted.getOrDefault(name, Boolean.FALSE);
    }

    /**
     * Arguments captured by the var-positional parameter, empty if none was declared.
     */
    @SuppressWarnings("unchecked")
    public List<Node> varPositional() {
        return signature.varPositional()
                .map(p -> (List<Node>) arguments.get(p.name()))
                .orElse(List.of());
    }

    /**
     * Keyword arguments captured by the var-keyword parameter, empty if none was declared.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Node> varKeyword() {
        return signature.varKeyword()
                .map(p -> (Map<String, Node>) arguments.get(p.name()))
                .orElse(Map.of());
    }

    @Override
    public String toString() {
        return "BoundArguments" + arguments;
    }
}
