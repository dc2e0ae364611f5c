package com.opstranslate.core.parser.script;

import java.util.Objects;

/**
 * Typed token of a script line.
 *
 * @param type token type
 * @param text token text; quotes, sigils and leading dashes removed
 * @param offset zero-based column where the token starts
 */
public record ScriptToken(
    Type type,
    String text,
    int offset
) {
    /**
     * Token types produced by {@link ScriptTokenizer}.
     */
    public enum Type {
        IDENTIFIER,
        NAMED_PARAMETER,
        QUOTED_STRING,
        VARIABLE_REFERENCE,
        NUMBER,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACE,
        RIGHT_BRACE,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        COMMA,
        EQUALS,
        PIPE,
        SEMICOLON,
        OPERATOR,
        SYMBOL
    }

    public ScriptToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    /**
     * Checks for an identifier with the given text, ignoring case.
     *
     * @param keyword keyword to compare
     * @return true if this is that identifier
     */
    public boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    /**
     * Returns true for tokens that can stand as a parameter value.
     *
     * @return true for identifiers, quoted strings, variable references and numbers
     */
    public boolean isValue() {
        return type == Type.IDENTIFIER || type == Type.QUOTED_STRING
            || type == Type.VARIABLE_REFERENCE || type == Type.NUMBER;
    }
}
