package com.opstranslate.core.parser.script;

/**
 * Raised by {@link ScriptTokenizer} for a line that cannot be tokenized, such as one
 * with an unterminated string. The statement parser turns it into a malformed unit.
 */
public class ScriptSyntaxException extends Exception {

    private final int offset;

    public ScriptSyntaxException(String message, int offset) {
        super(message + " at column " + (offset + 1));
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
