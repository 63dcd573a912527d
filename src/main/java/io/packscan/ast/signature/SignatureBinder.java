package io.packscan.ast.signature;

import io.packscan.ast.CallNode;
import io.packscan.ast.DictionaryNode;
import io.packscan.ast.Node;
import io.packscan.ast.StringNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds the actual arguments of a call site to the formal parameters of a signature,
 * independent of how the caller ordered or spelled them.
 * <p>
 * Positional arguments fill positional-only then positional-or-keyword parameters left to
 * right; the rest go to the var-positional parameter or fail the binding. Keyword arguments
 * fill parameters by name; unknown names go to the var-keyword parameter or fail the binding.
 * Omitted parameters take their default, or fail the binding if they have none. A binding is
 * all or nothing.
 */
public final class SignatureBinder {

    private static final Logger log = LoggerFactory.getLogger(SignatureBinder.class);

    private SignatureBinder() {
    }

    /**
     * Binds a call node. A dictionary literal passed as the keyword collection is materialized
     * into ordinary keywords first.
     *
     * @throws SignatureBindingException if the call does not fit the signature
     */
    public static BoundArguments bind(CallNode call, CallSignature signature) throws SignatureBindingException {
        return bind(call.args(), keywordsOf(call), signature);
    }

    /**
     * Like {@link #bind(CallNode, CallSignature)}, but reports a mismatch as an empty result.
     */
    public static Optional<BoundArguments> tryBind(CallNode call, CallSignature signature) {
        try {
            return Optional.of(bind(call, signature));
        } catch (SignatureBindingException e) {
            log.debug("Call {} does not match signature {}: {}", call, signature, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Binds explicit positional and keyword arguments.
     */
    public static BoundArguments bind(List<Node> args,
                                      Map<String, Node> kwargs,
                                      CallSignature signature) throws SignatureBindingException {
        List<Parameter> parameters = signature.parameters();
        Map<String, Object> bound = new HashMap<>();
        Map<String, Boolean> defaulted = new HashMap<>();
        Map<String, Node> remaining = new LinkedHashMap<>(kwargs);

        // Positional arguments, left to right
        int index = 0;
        for (Parameter parameter : parameters) {
            if (parameter.kind().acceptsPositional()) {
                if (index < args.size()) {
                    bound.put(parameter.name(), args.get(index++));
                }
            } else if (parameter.kind() == Parameter.Kind.VAR_POSITIONAL) {
                bound.put(parameter.name(), List.copyOf(args.subList(index, args.size())));
                index = args.size();
            }
        }
        if (index < args.size()) {
            throw new SignatureBindingException("too many positional arguments: got " + args.size()
                    + ", at most " + index + " accepted");
        }

        // Keywords and defaults for everything not bound positionally
        for (Parameter parameter : parameters) {
            String name = parameter.name();
            if (parameter.kind().isVariadic()) {
                continue;
            }
            if (bound.containsKey(name)) {
                if (parameter.kind().acceptsKeyword() && remaining.containsKey(name)) {
                    throw new SignatureBindingException("multiple values for argument '" + name + "'");
                }
                continue;
            }
            if (parameter.kind().acceptsKeyword() && remaining.containsKey(name)) {
                bound.put(name, remaining.remove(name));
            } else if (parameter.hasDefault()) {
                bound.put(name, parameter.defaultValue());
                defaulted.put(name, Boolean.TRUE);
            } else {
                throw new SignatureBindingException("missing required argument '" + name + "'");
            }
        }

        // Leftover keywords
        Optional<Parameter> varKeyword = signature.varKeyword();
        if (varKeyword.isPresent()) {
            bound.put(varKeyword.get().name(), Collections.unmodifiableMap(new LinkedHashMap<>(remaining)));
        } else if (!remaining.isEmpty()) {
            throw new SignatureBindingException("unexpected keyword argument(s) " + remaining.keySet());
        }

        Map<String, Object> ordered = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            ordered.put(parameter.name(), bound.get(parameter.name()));
        }
        return new BoundArguments(signature, ordered, defaulted);
    }

    private static Map<String, Node> keywordsOf(CallNode call) throws SignatureBindingException {
        Optional<Node> collection = call.kwargsDictionary();
        if (collection.isEmpty()) {
            return call.kwargs();
        }
        if (!(collection.get() instanceof DictionaryNode dictionary)) {
            throw new SignatureBindingException("keyword collection is not a dictionary literal");
        }
        Map<String, Node> keywords = new LinkedHashMap<>(call.kwargs());
        for (int i = 0; i < dictionary.size(); i++) {
            if (!(dictionary.keys().get(i) instanceof StringNode key)) {
                throw new SignatureBindingException("keywords must be strings");
            }
            if (call.kwargs().containsKey(key.value())) {
                throw new SignatureBindingException("multiple values for keyword argument '" + key.value() + "'");
            }
            keywords.put(key.value(), dictionary.values().get(i));
        }
        return keywords;
    }
}
