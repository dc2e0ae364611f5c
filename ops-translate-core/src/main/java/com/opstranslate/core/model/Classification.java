package com.opstranslate.core.model;

import java.util.Locale;

/**
 * Category assigned to every {@link SourceUnit}.
 *
 * <p>The category routes a unit to its mapping sub-table and carries no other meaning.
 * {@link #UNKNOWN} units are never mapped; they are reported as gaps.
 */
public enum Classification {
    /** Establishes state: variable assignments, declared inputs and outputs. */
    CONTEXT,

    /** Read-only query against the source platform. */
    LOOKUP,

    /** Creates, starts, stops, changes or removes a resource. */
    MUTATION,

    /** Calls a named external-system action. */
    INTEGRATION,

    /** Conditional that raises, aborts or waits for approval. */
    GATE,

    /** No matcher applied. */
    UNKNOWN;

    /**
     * Returns the lowercase key used in rule tables and serialized output.
     *
     * @return category key, e.g. {@code "mutation"}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a rule-table key to a category.
     *
     * @param key category key, case-insensitive
     * @return matching category
     * @throws IllegalArgumentException if the key names no category
     */
    public static Classification fromKey(String key) {
        for (Classification classification : values()) {
            if (classification.key().equalsIgnoreCase(key)) {
                return classification;
            }
        }
        throw new IllegalArgumentException("Unknown classification: " + key);
    }
}
