package com.opstranslate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One parsed script statement or workflow graph node, before classification.
 *
 * <p>Units are immutable. Corrections happen by re-parsing, never by mutation.
 * Parameter names keep their source spelling and order; lookups through
 * {@link #parameter(String)} ignore case, as both source grammars do.
 *
 * @param sourceName document the unit came from
 * @param location line ({@code "line 4"}) or workflow item name
 * @param position zero-based position in document order, used as the ordering tie-break
 * @param kind statement or graph node
 * @param shape structural form recognised by the parser
 * @param identifier command, call, action or node identifier; null for opaque units
 * @param parameters named parameters in source order
 * @param pipedTo next command of a script pipeline, or null
 * @param rawText original text
 */
public record SourceUnit(
    String sourceName,
    String location,
    int position,
    UnitKind kind,
    UnitShape shape,
    String identifier,
    Map<String, ParameterValue> parameters,
    String pipedTo,
    String rawText
) {
    /**
     * Compact constructor with validation.
     */
    public SourceUnit {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        if (rawText == null) {
            rawText = "";
        }
    }

    /**
     * Creates an opaque unit that keeps only its raw text.
     *
     * @param sourceName document name
     * @param location unit location
     * @param position document position
     * @param kind statement or graph node
     * @param shape {@link UnitShape#MALFORMED} or {@link UnitShape#UNRECOGNIZED}
     * @param rawText original text
     * @return unit without identifier or parameters
     */
    public static SourceUnit opaque(String sourceName, String location, int position,
                                    UnitKind kind, UnitShape shape, String rawText) {
        return new SourceUnit(sourceName, location, position, kind, shape, null, Map.of(), null, rawText);
    }

    /**
     * Looks up a parameter ignoring case.
     *
     * @param name parameter name
     * @return the value, or empty if absent
     */
    public Optional<ParameterValue> parameter(String name) {
        ParameterValue exact = parameters.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return parameters.entrySet().stream()
            .filter(entry -> entry.getKey().equalsIgnoreCase(name))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    public boolean hasParameter(String name) {
        return parameter(name).isPresent();
    }

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isEmpty();
    }

    /**
     * Returns the reference carried by tasks and gaps derived from this unit.
     *
     * @return unit reference
     */
    public UnitReference reference() {
        return new UnitReference(sourceName, location, rawText.strip());
    }
}
