package io.packscan.ast.signature;

import java.util.Objects;

/**
 * One formal parameter of a {@link CallSignature}.
 *
 * @param name         Parameter name
 * @param kind         How the parameter can be supplied
 * @param hasDefault   True if the parameter may be omitted
 * @param defaultValue Value used when omitted; may be {@code null} (the "None" default)
 */
public record Parameter(
        String name,
        Kind kind,
        boolean hasDefault,
        Object defaultValue
) {
    /**
     * Parameter kinds, in the order they must appear in a signature.
     */
    public enum Kind {
        POSITIONAL_ONLY,
        POSITIONAL_OR_KEYWORD,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD;

        boolean isVariadic() {
            return this == VAR_POSITIONAL || this == VAR_KEYWORD;
        }

        boolean acceptsPositional() {
            return this == POSITIONAL_ONLY || this == POSITIONAL_OR_KEYWORD;
        }

        boolean acceptsKeyword() {
            return this == POSITIONAL_OR_KEYWORD || this == KEYWORD_ONLY;
        }
    }

    /**
     * Compact constructor with validation.
     */
    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Objects.requireNonNull(kind, "kind");
        if (hasDefault && kind.isVariadic()) {
            throw new IllegalArgumentException("variadic parameter cannot have a default: " + name);
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("default value given for required parameter: " + name);
        }
    }

    public static Parameter required(String name, Kind kind) {
        return new Parameter(name, kind, false, null);
    }

    public static Parameter withDefault(String name, Kind kind, Object defaultValue) {
        return new Parameter(name, kind, true, defaultValue);
    }
}
