package com.opstranslate.core.model;

/**
 * Structural form recognised by a parser for a single {@link SourceUnit}.
 *
 * <p>Shapes describe syntax only. The classifier combines the shape with the unit
 * identifier to decide the {@link Classification}.
 */
public enum UnitShape {
    /** {@code Verb-Noun -Param value} invocation. */
    COMMAND,

    /** {@code Name(key=value, ...)} invocation. */
    CALL,

    /** Variable assignment with a non-command right-hand side. */
    ASSIGNMENT,

    /** {@code throw}, optionally guarded by an enclosing {@code if}. */
    THROW,

    /** {@code if}/{@code else} line that does not simply guard a throw. */
    CONDITIONAL,

    /** Declared input parameter (script {@code param} block or workflow input). */
    INPUT,

    /** Declared workflow output parameter. */
    OUTPUT,

    /** Workflow task whose script has no recognised form. */
    TASK,

    /** Workflow task calling a packaged action ({@code System.getModule(..).action(..)}). */
    ACTION_CALL,

    /** Workflow decision point. */
    DECISION,

    /** Workflow item waiting on a human (approval, user input, external event). */
    INTERACTION,

    /** Workflow item invoking another workflow. */
    LINK,

    /** Input the tokenizer could not read (unterminated string, unbalanced brackets). */
    MALFORMED,

    /** Well-formed input that matches no known statement or node form. */
    UNRECOGNIZED;

    /**
     * Returns true for shapes that can never be mapped and always classify as unknown.
     *
     * @return true for {@link #MALFORMED} and {@link #UNRECOGNIZED}
     */
    public boolean isOpaque() {
        return this == MALFORMED || this == UNRECOGNIZED;
    }
}
