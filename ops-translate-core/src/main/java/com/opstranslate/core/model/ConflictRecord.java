package com.opstranslate.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Irreconcilable difference found while merging source intents.
 *
 * @param subject field key or {@code "inputs.<name>"}
 * @param type conflict kind
 * @param valuesBySource each distinct value mapped to the sorted sources that declared it
 * @param retainedValue value kept in the merged intent, or null when the field is left unset
 * @param remediation operator guidance
 */
public record ConflictRecord(
    String subject,
    ConflictType type,
    Map<String, List<String>> valuesBySource,
    String retainedValue,
    String remediation
) {
    /**
     * Compact constructor with validation. Values are stored sorted so that records
     * built from any source permutation compare equal.
     */
    public ConflictRecord {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(valuesBySource, "valuesBySource must not be null");
        Map<String, List<String>> sorted = new TreeMap<>();
        valuesBySource.forEach((value, sources) ->
            sorted.put(value, sources.stream().sorted().distinct().toList()));
        valuesBySource = Collections.unmodifiableMap(sorted);
        if (remediation == null) {
            remediation = "";
        }
    }

    /**
     * Returns true if the merged intent leaves the subject unset pending operator resolution.
     *
     * @return true when no value was retained
     */
    public boolean leavesUnset() {
        return retainedValue == null;
    }
}
