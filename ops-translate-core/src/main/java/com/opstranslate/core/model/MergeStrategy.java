package com.opstranslate.core.model;

/**
 * How values of one {@link IntentField} combine across sources.
 */
public enum MergeStrategy {
    /** List values combine as a set. */
    UNION,

    /** Numeric values take the maximum. */
    MAXIMUM,

    /** Numeric limits take the minimum, the most restrictive quota. */
    MINIMUM,

    /** Boolean flags combine with logical OR. */
    MOST_RESTRICTIVE,

    /** Values must be equal; a mismatch is recorded and the field is left unset. */
    EXPLICIT_CONFLICT,

    /** Equal values merge; differing values become {@code "mixed"}. */
    MIXED
}
