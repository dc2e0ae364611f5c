package com.opstranslate.core.parser;

/**
 * Thrown when a source document cannot be parsed as a whole.
 *
 * <p>Scoped to a single document: the pipeline records it as a failed file and
 * continues with the rest of the run.
 */
public class StructuralParseException extends Exception {

    private final String sourceName;

    public StructuralParseException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public StructuralParseException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
