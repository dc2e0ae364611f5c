package com.opstranslate.core.rules;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.IntentField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative rule mapping matching source units to a target action and parameter template.
 *
 * @param id unique rule id
 * @param category category sub-table the rule belongs to
 * @param description task name template
 * @param matcher unit predicate
 * @param targetAction target module or action
 * @param params parameter template; nested maps and lists allowed
 * @param requiredProfilePaths dotted profile paths the rule needs, declared and referenced
 * @param requirements requirement field templates recorded into the source intent
 * @param tags tags added to produced tasks
 */
public record MappingRule(
    String id,
    Classification category,
    String description,
    UnitMatcher matcher,
    String targetAction,
    Map<String, Object> params,
    List<String> requiredProfilePaths,
    Map<IntentField, Object> requirements,
    List<String> tags
) {
    /**
     * Compact constructor with validation.
     */
    public MappingRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(targetAction, "targetAction must not be null");
        if (description == null || description.isBlank()) {
            description = id;
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        requiredProfilePaths = requiredProfilePaths == null ? List.of() : List.copyOf(requiredProfilePaths);
        EnumMap<IntentField, Object> orderedRequirements = new EnumMap<>(IntentField.class);
        if (requirements != null) {
            orderedRequirements.putAll(requirements);
        }
        requirements = Collections.unmodifiableMap(orderedRequirements);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
