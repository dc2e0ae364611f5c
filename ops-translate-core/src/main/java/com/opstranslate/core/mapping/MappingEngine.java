package com.opstranslate.core.mapping;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.rules.MappingRule;
import com.opstranslate.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches classified units against the category sub-table of the rule table and renders
 * the rule's templates.
 *
 * <p>Rules in a sub-table are tried in file order; the first match wins. A unit without a
 * matching rule yields {@link MappingOutcome.NoMatch}, never an exception.
 */
public final class MappingEngine {

    private static final Logger log = LoggerFactory.getLogger(MappingEngine.class);

    private final RuleTable ruleTable;
    private final TemplateRenderer renderer;

    public MappingEngine(RuleTable ruleTable) {
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable must not be null");
        this.renderer = new TemplateRenderer();
    }

    /**
     * Maps a classified unit.
     *
     * @param unit source unit
     * @param category its classification, never {@link Classification#UNKNOWN}
     * @return mapped task or no-match
     * @throws IllegalArgumentException if the unit is unclassified
     */
    public MappingOutcome map(SourceUnit unit, Classification category) {
        if (category == Classification.UNKNOWN) {
            throw new IllegalArgumentException("unclassified units are not mapped: " + unit.reference().describe());
        }

        Optional<MappingRule> match = ruleTable.findRule(unit, category);
        if (match.isEmpty()) {
            String identifier = unit.hasIdentifier() ? unit.identifier() : unit.shape().name();
            log.debug("{}: no {} rule for '{}'", unit.reference().describe(), category.key(), identifier);
            return new MappingOutcome.NoMatch(
                "No " + category.key() + " rule matches '" + identifier + "'",
                "Add a rule matching '" + identifier + "' to the '" + category.key()
                    + "' section of the rule table (rule table version " + ruleTable.version() + ")");
        }

        MappingRule rule = match.get();
        String name = renderer.renderLabel(rule.description(), unit);
        Map<String, Object> params = renderer.renderMap(rule.params(), unit);
        List<Requirement> requirements = requirements(rule, unit);
        log.debug("{}: rule '{}' -> {}", unit.reference().describe(), rule.id(), rule.targetAction());

        return new MappingOutcome.Mapped(new PartialTask(unit.reference(), rule.id(), category, name,
            rule.targetAction(), params, rule.requiredProfilePaths(), requirements, rule.tags()));
    }

    private List<Requirement> requirements(MappingRule rule, SourceUnit unit) {
        List<Requirement> requirements = new ArrayList<>();
        for (Map.Entry<IntentField, Object> entry : rule.requirements().entrySet()) {
            if (renderer.referencesVariable(entry.getValue(), unit)) {
                // value only known when the target automation runs
                continue;
            }
            renderer.render(entry.getValue(), unit).ifPresent(value ->
                requirements.add(new Requirement(entry.getKey(), value, unit.reference().describe())));
        }
        return requirements;
    }
}
