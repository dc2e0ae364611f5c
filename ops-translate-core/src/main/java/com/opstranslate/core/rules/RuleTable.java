package com.opstranslate.core.rules;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.SourceUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned mapping rule table: one ordered sub-table per category plus the
 * classifier matchers.
 *
 * <p>Loaded once per run and shared read-only by every pipeline stage and worker thread.
 *
 * @see RuleTableLoader
 */
public final class RuleTable {

    private final String version;
    private final Map<Classification, List<MappingRule>> rules;
    private final ClassifierRules classifierRules;

    public RuleTable(String version, Map<Classification, List<MappingRule>> rules, ClassifierRules classifierRules) {
        this.version = Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        this.classifierRules = Objects.requireNonNull(classifierRules, "classifierRules must not be null");
        EnumMap<Classification, List<MappingRule>> copy = new EnumMap<>(Classification.class);
        rules.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        this.rules = Collections.unmodifiableMap(copy);
    }

    public String version() {
        return version;
    }

    public ClassifierRules classifierRules() {
        return classifierRules;
    }

    /**
     * Returns the sub-table for a category, in file order.
     *
     * @param category category
     * @return rules, empty for categories without rules
     */
    public List<MappingRule> rulesFor(Classification category) {
        return rules.getOrDefault(category, List.of());
    }

    /**
     * Finds the first rule of the category sub-table matching the unit.
     *
     * @param unit classified unit
     * @param category its classification
     * @return first matching rule, or empty
     */
    public Optional<MappingRule> findRule(SourceUnit unit, Classification category) {
        return rulesFor(category).stream()
            .filter(rule -> rule.matcher().matches(unit))
            .findFirst();
    }

    /**
     * Returns every rule, categories in declaration order.
     *
     * @return all rules
     */
    public List<MappingRule> allRules() {
        return rules.values().stream().flatMap(List::stream).toList();
    }

    public int size() {
        return rules.values().stream().mapToInt(List::size).sum();
    }
}
