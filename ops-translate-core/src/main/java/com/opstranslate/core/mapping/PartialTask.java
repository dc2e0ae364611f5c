package com.opstranslate.core.mapping;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.UnitReference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Task produced by the mapping engine, before profile values are filled in.
 *
 * @param unit evidence reference
 * @param ruleId matching rule id
 * @param category unit classification
 * @param name rendered task name, may still hold profile placeholders
 * @param targetAction target module or action
 * @param params rendered parameters, may still hold profile placeholders
 * @param requiredProfilePaths profile paths the rule needs
 * @param requirements requirement values recorded by the rule
 * @param tags rule tags
 */
public record PartialTask(
    UnitReference unit,
    String ruleId,
    Classification category,
    String name,
    String targetAction,
    Map<String, Object> params,
    List<String> requiredProfilePaths,
    List<Requirement> requirements,
    List<String> tags
) {
    /**
     * Compact constructor with validation.
     */
    public PartialTask {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(targetAction, "targetAction must not be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        requiredProfilePaths = requiredProfilePaths == null ? List.of() : List.copyOf(requiredProfilePaths);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
