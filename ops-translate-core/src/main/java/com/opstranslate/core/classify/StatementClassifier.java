package com.opstranslate.core.classify;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitShape;
import com.opstranslate.core.rules.ClassifierRules;
import com.opstranslate.core.rules.UnitMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns each source unit exactly one {@link Classification}.
 *
 * <p>Evaluation order, first hit wins:
 * <ol>
 *   <li>Structural shapes: throws, decisions and user interactions are gates; assignments,
 *       inputs and outputs are context.</li>
 *   <li>Identifier matchers of {@link ClassifierRules}, tried per category in the order
 *       gate, context, integration, lookup, mutation.</li>
 *   <li>Otherwise {@link Classification#UNKNOWN}. Malformed and unrecognized units are
 *       always unknown.</li>
 * </ol>
 */
public final class StatementClassifier {

    private static final Logger log = LoggerFactory.getLogger(StatementClassifier.class);

    private static final List<Classification> MATCH_ORDER = List.of(
        Classification.GATE,
        Classification.CONTEXT,
        Classification.INTEGRATION,
        Classification.LOOKUP,
        Classification.MUTATION
    );

    private final ClassifierRules rules;

    public StatementClassifier(ClassifierRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * Classifies a unit.
     *
     * @param unit parsed unit
     * @return its category, {@link Classification#UNKNOWN} if nothing matches
     */
    public Classification classify(SourceUnit unit) {
        Optional<Classification> byShape = classifyShape(unit.shape());
        if (byShape.isPresent()) {
            return byShape.get();
        }
        if (unit.shape().isOpaque()) {
            return Classification.UNKNOWN;
        }
        for (Classification category : MATCH_ORDER) {
            for (UnitMatcher matcher : rules.matchersFor(category)) {
                if (matcher.matches(unit)) {
                    log.debug("{} classified as {} by {}", unit.reference().describe(), category.key(), matcher);
                    return category;
                }
            }
        }
        log.debug("{} ('{}') matched no classifier", unit.reference().describe(), unit.identifier());
        return Classification.UNKNOWN;
    }

    private static Optional<Classification> classifyShape(UnitShape shape) {
        return switch (shape) {
            case THROW, DECISION, INTERACTION -> Optional.of(Classification.GATE);
            case ASSIGNMENT, INPUT, OUTPUT -> Optional.of(Classification.CONTEXT);
            case COMMAND, CALL, ACTION_CALL, TASK, LINK, CONDITIONAL, MALFORMED, UNRECOGNIZED -> Optional.empty();
        };
    }
}
