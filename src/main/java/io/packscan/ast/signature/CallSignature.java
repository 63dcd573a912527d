package io.packscan.ast.signature;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared formal parameter shape that call sites are bound against.
 * <p>
 * Parameters are kept in declaration order: positional-only, positional-or-keyword,
 * var-positional, keyword-only, var-keyword. At most one of each variadic kind is allowed and
 * a positional parameter without default may not follow one with a default.
 */
public final class CallSignature {

    private final List<Parameter> parameters;

    private CallSignature(List<Parameter> parameters) {
        validate(parameters);
        this.parameters = List.copyOf(parameters);
    }

    public static CallSignature of(List<Parameter> parameters) {
        return new CallSignature(parameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Optional<Parameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    Optional<Parameter> varPositional() {
        return parameters.stream().filter(p -> p.kind() == Parameter.Kind.VAR_POSITIONAL).findFirst();
    }

    Optional<Parameter> varKeyword() {
        return parameters.stream().filter(p -> p.kind() == Parameter.Kind.VAR_KEYWORD).findFirst();
    }

    private static void validate(List<Parameter> parameters) {
        Set<String> names = new HashSet<>();
        Parameter.Kind previousKind = null;
        boolean positionalDefaultSeen = false;

        for (Parameter parameter : parameters) {
            if (!names.add(parameter.name())) {
                throw new IllegalArgumentException("duplicate parameter name: " + parameter.name());
            }
            Parameter.Kind kind = parameter.kind();
            if (previousKind != null) {
                if (kind.ordinal() < previousKind.ordinal()) {
                    throw new IllegalArgumentException("parameter " + parameter.name() + " of kind "
                            + kind + " cannot follow a parameter of kind " + previousKind);
                }
                if (kind == previousKind && kind.isVariadic()) {
                    throw new IllegalArgumentException("more than one " + kind + " parameter");
                }
            }
            if (kind.acceptsPositional()) {
                if (parameter.hasDefault()) {
                    positionalDefaultSeen = true;
                } else if (positionalDefaultSeen) {
                    throw new IllegalArgumentException("non-default parameter " + parameter.name()
                            + " follows a default parameter");
                }
            }
            previousKind = kind;
        }
    }

    @Override
    public String toString() {
        return parameters.stream().map(CallSignature::describe)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String describe(Parameter p) {
        return switch (p.kind()) {
            case VAR_POSITIONAL -> "*" + p.name();
            case VAR_KEYWORD -> "**" + p.name();
            default -> p.hasDefault() ? p.name() + "=" + p.defaultValue() : p.name();
        };
    }

    /**
     * Collects parameters in declaration order.
     */
    public static class Builder {
        private final List<Parameter> parameters = new ArrayList<>();

        public Builder positionalOnly(String name) {
            parameters.add(Parameter.required(name, Parameter.Kind.POSITIONAL_ONLY));
            return this;
        }

        public Builder positionalOrKeyword(String name) {
            parameters.add(Parameter.required(name, Parameter.Kind.POSITIONAL_OR_KEYWORD));
            return this;
        }

        /**
         * Positional-or-keyword parameter with a default value.
         */
        public Builder keyword(String name, Object defaultValue) {
            parameters.add(Parameter.withDefault(name, Parameter.Kind.POSITIONAL_OR_KEYWORD, defaultValue));
            return this;
        }

        public Builder varPositional(String name) {
            parameters.add(Parameter.required(name, Parameter.Kind.VAR_POSITIONAL));
            return this;
        }

        public Builder keywordOnly(String name) {
            parameters.add(Parameter.required(name, Parameter.Kind.KEYWORD_ONLY));
            return this;
        }

        public Builder keywordOnly(String name, Object defaultValue) {
            parameters.add(Parameter.withDefault(name, Parameter.Kind.KEYWORD_ONLY, defaultValue));
            return this;
        }

        public Builder varKeyword(String name) {
            parameters.add(Parameter.required(name, Parameter.Kind.VAR_KEYWORD));
            return this;
        }

        public CallSignature build() {
            return new CallSignature(parameters);
        }
    }
}
