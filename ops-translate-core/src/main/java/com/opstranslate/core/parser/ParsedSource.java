package com.opstranslate.core.parser;

import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.SourceUnit;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one document: units in execution order plus declared inputs.
 *
 * @param sourceName document name
 * @param kind script or workflow
 * @param units units in execution order
 * @param inputs input declarations in declaration order
 */
public record ParsedSource(
    String sourceName,
    SourceKind kind,
    List<SourceUnit> units,
    List<InputDefinition> inputs
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedSource {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        units = units == null ? List.of() : List.copyOf(units);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
