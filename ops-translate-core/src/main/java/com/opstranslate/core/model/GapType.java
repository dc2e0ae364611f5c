package com.opstranslate.core.model;

/**
 * Reason a piece of source automation was not translated into a resolved task.
 */
public enum GapType {
    /** Unit classified as unknown. */
    UNCLASSIFIED("unknown", GapSeverity.WARNING),

    /** Classified unit with no matching mapping rule. */
    NO_MATCH("no_match", GapSeverity.WARNING),

    /** Task emitted as a blocked stub because profile configuration is missing. */
    BLOCKED("blocked", GapSeverity.WARNING),

    /** Irreconcilable field difference found while merging intents. */
    MERGE_CONFLICT("conflict", GapSeverity.WARNING),

    /** Document could not be parsed or ordered. */
    STRUCTURAL("structural", GapSeverity.ERROR),

    /** Document translation was cancelled. */
    SKIPPED("skipped", GapSeverity.INFO);

    private final String key;
    private final GapSeverity defaultSeverity;

    GapType(String key, GapSeverity defaultSeverity) {
        this.key = key;
        this.defaultSeverity = defaultSeverity;
    }

    /**
     * Returns the report key, e.g. {@code "no_match"}.
     *
     * @return lowercase key used in gap reports
     */
    public String key() {
        return key;
    }

    public GapSeverity defaultSeverity() {
        return defaultSeverity;
    }
}
