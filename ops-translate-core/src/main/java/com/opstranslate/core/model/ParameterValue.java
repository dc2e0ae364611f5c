package com.opstranslate.core.model;

import java.util.Objects;

/**
 * Value of one named parameter on a {@link SourceUnit}.
 *
 * <p>A variable reference is kept symbolic: its value is only known when the target
 * automation runs, so mapping converts it into target templating syntax instead of a literal.
 *
 * @param text literal text, or the variable name without its sigil for {@link ValueType#VARIABLE}
 * @param type how the value was written in the source
 */
public record ParameterValue(
    String text,
    ValueType type
) {
    /**
     * How a parameter value was written.
     */
    public enum ValueType {
        /** Bare word or number. */
        LITERAL,
        /** Quoted string; quotes removed. */
        QUOTED,
        /** Reference to a variable ({@code $name} or a workflow binding). */
        VARIABLE
    }

    /**
     * Compact constructor with validation.
     */
    public ParameterValue {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ParameterValue literal(String text) {
        return new ParameterValue(text, ValueType.LITERAL);
    }

    public static ParameterValue quoted(String text) {
        return new ParameterValue(text, ValueType.QUOTED);
    }

    public static ParameterValue variable(String name) {
        return new ParameterValue(name, ValueType.VARIABLE);
    }

    public boolean isVariableReference() {
        return type == ValueType.VARIABLE;
    }

    /**
     * Returns the value as written in a script, with sigil or quotes restored.
     *
     * @return source notation of the value
     */
    public String toSourceNotation() {
        return switch (type) {
            case LITERAL -> text;
            case QUOTED -> "\"" + text + "\"";
            case VARIABLE -> "$" + text;
        };
    }
}
