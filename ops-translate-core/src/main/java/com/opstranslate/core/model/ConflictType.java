package com.opstranslate.core.model;

/**
 * Kind of difference recorded in a {@link ConflictRecord}.
 */
public enum ConflictType {
    /** Same input name declared with different type, required flag or default. */
    INPUT_DEFINITION,

    /** Explicit-conflict field declared with different values. */
    FIELD_VALUE,

    /** Value that the field's strategy cannot combine (e.g. non-numeric for a maximum). */
    INVALID_VALUE
}
