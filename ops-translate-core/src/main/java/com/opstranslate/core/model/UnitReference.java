package com.opstranslate.core.model;

import java.util.Objects;

/**
 * Pointer back to the source evidence of a task, gap or requirement.
 *
 * @param sourceName document name
 * @param location line ({@code "line 12"}) or workflow item ({@code "item3"})
 * @param rawText original text of the unit
 */
public record UnitReference(
    String sourceName,
    String location,
    String rawText
) {
    /**
     * Compact constructor with validation.
     */
    public UnitReference {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (rawText == null) {
            rawText = "";
        }
    }

    /**
     * Returns {@code source:location}, the form used in logs and reports.
     *
     * @return short reference string
     */
    public String describe() {
        return sourceName + ":" + location;
    }
}
