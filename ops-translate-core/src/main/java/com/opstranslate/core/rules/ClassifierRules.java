package com.opstranslate.core.rules;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.UnitShape;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered identifier matchers per category, used by the statement classifier after its
 * fixed shape rules.
 *
 * <p>A rule table may replace the matchers of any category in its {@code classification}
 * section; categories it leaves out keep {@link #defaults()}.
 */
public final class ClassifierRules {

    private static final String VERB_SUFFIX = "(-.*|[A-Z_].*)?";

    private final Map<Classification, List<UnitMatcher>> matchers;

    public ClassifierRules(Map<Classification, List<UnitMatcher>> matchers) {
        Objects.requireNonNull(matchers, "matchers must not be null");
        EnumMap<Classification, List<UnitMatcher>> copy = new EnumMap<>(Classification.class);
        matchers.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        copy.remove(Classification.UNKNOWN);
        this.matchers = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the built-in matchers.
     *
     * <p>Integration wins over lookup and mutation, so {@code New-Snapshot} is an integration
     * even though it starts with a mutation verb. Verb patterns accept both cmdlet
     * ({@code Get-VM}) and camel-case ({@code getVirtualMachine}) identifiers.
     *
     * @return default classifier rules
     */
    public static ClassifierRules defaults() {
        Map<Classification, List<UnitMatcher>> defaults = new EnumMap<>(Classification.class);
        defaults.put(Classification.CONTEXT, List.of(
            UnitMatcher.pattern("(?i:write)-.*"),
            UnitMatcher.pattern("(?i)System\\.(log|warn|debug|error)")
        ));
        defaults.put(Classification.INTEGRATION, List.of(
            UnitMatcher.identifier("Invoke-RestMethod"),
            UnitMatcher.identifier("Invoke-WebRequest"),
            UnitMatcher.shape(UnitShape.LINK),
            UnitMatcher.pattern("(?i).*(snapshot|tagassignment|assigntag|networkadapter).*"),
            UnitMatcher.pattern("(?i).*(servicenow|infoblox|nsx).*")
        ));
        defaults.put(Classification.LOOKUP, List.of(
            UnitMatcher.pattern("(?i:get|find|list|search|read|lookup)" + VERB_SUFFIX)
        ));
        defaults.put(Classification.MUTATION, List.of(
            UnitMatcher.pattern("(?i:new|create|start|stop|restart|remove|delete|destroy|set|update|reconfigure|move|clone|deploy|add|power|shutdown)"
                + VERB_SUFFIX)
        ));
        return new ClassifierRules(defaults);
    }

    /**
     * Returns a copy with the given categories replaced.
     *
     * @param overrides matchers per category
     * @return merged classifier rules
     */
    public ClassifierRules withOverrides(Map<Classification, List<UnitMatcher>> overrides) {
        EnumMap<Classification, List<UnitMatcher>> merged = new EnumMap<>(Classification.class);
        merged.putAll(matchers);
        merged.putAll(overrides);
        return new ClassifierRules(merged);
    }

    /**
     * Returns the matchers for a category, in evaluation order.
     *
     * @param category category
     * @return matchers, empty if none
     */
    public List<UnitMatcher> matchersFor(Classification category) {
        return matchers.getOrDefault(category, List.of());
    }
}
