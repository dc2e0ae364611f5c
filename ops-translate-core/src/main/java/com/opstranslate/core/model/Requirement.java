package com.opstranslate.core.model;

import java.util.Objects;

/**
 * Requirement value declared by a source, recorded by a mapping rule.
 *
 * @param field requirement field
 * @param value value as rendered from the rule template (number, boolean or string)
 * @param origin short reference of the unit that declared it
 */
public record Requirement(
    IntentField field,
    Object value,
    String origin
) {
    /**
     * Compact constructor with validation.
     */
    public Requirement {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }
}
