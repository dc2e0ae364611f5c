package com.opstranslate.core.pipeline;

import com.opstranslate.core.classify.StatementClassifier;
import com.opstranslate.core.graph.DependencyCycleException;
import com.opstranslate.core.mapping.MappingEngine;
import com.opstranslate.core.mapping.MappingOutcome;
import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitReference;
import com.opstranslate.core.parser.ParsedSource;
import com.opstranslate.core.parser.SourceParser;
import com.opstranslate.core.parser.SourceParserRegistry;
import com.opstranslate.core.parser.StructuralParseException;
import com.opstranslate.core.profile.Profile;
import com.opstranslate.core.profile.ProfileResolver;
import com.opstranslate.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates one document: parse, classify, map, resolve.
 *
 * <p>A pure function of (document, rule table, profile). The pipeline holds only immutable
 * collaborators, so one instance can serve many threads. Every unit the parser returns ends
 * up as exactly one resolved task, blocked task or gap.
 */
public final class TranslationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TranslationPipeline.class);

    private final SourceParserRegistry parsers;
    private final StatementClassifier classifier;
    private final MappingEngine mappingEngine;
    private final ProfileResolver profileResolver;

    public TranslationPipeline(RuleTable ruleTable, Profile profile, SourceParserRegistry parsers) {
        Objects.requireNonNull(ruleTable, "ruleTable must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        this.parsers = Objects.requireNonNull(parsers, "parsers must not be null");
        this.classifier = new StatementClassifier(ruleTable.classifierRules());
        this.mappingEngine = new MappingEngine(ruleTable);
        this.profileResolver = new ProfileResolver(profile);
    }

    /**
     * Translates a document.
     *
     * @param document located and read document
     * @return translated outcome, or failed for structural problems
     */
    public TranslationOutcome translate(SourceDocument document) {
        Optional<SourceParser> parser = parsers.parserFor(document);
        if (parser.isEmpty()) {
            log.error("No parser supports {}", document.name());
            return TranslationOutcome.failed(document.name(), structuralGap(document.name(), "document",
                "No parser supports '" + document.name() + "'",
                "Use a .ps1/.psm1 script or a .xml workflow export"));
        }

        ParsedSource parsed;
        try {
            parsed = parser.get().parse(document);
        } catch (DependencyCycleException e) {
            log.error("Translation of {} aborted: {}", document.name(), e.getMessage());
            return TranslationOutcome.failed(document.name(), structuralGap(document.name(), "graph",
                e.getMessage(), "Break the cycle between " + String.join(", ", e.getCycleNodes())
                    + " in the workflow and re-export it"));
        } catch (StructuralParseException e) {
            log.error("Translation of {} aborted: {}", document.name(), e.getMessage());
            return TranslationOutcome.failed(document.name(), structuralGap(document.name(), "document",
                e.getMessage(), "Fix or re-export the document"));
        }

        SourceIntent intent = translateUnits(parsed, parser.get());
        log.info("Translated {}: {} tasks ({} blocked), {} gaps", document.name(), intent.tasks().size(),
            intent.blockedTasks().size(), intent.gaps().size());
        return TranslationOutcome.translated(intent);
    }

    private SourceIntent translateUnits(ParsedSource parsed, SourceParser parser) {
        List<ResolvedTask> tasks = new ArrayList<>();
        List<Gap> gaps = new ArrayList<>();
        List<Requirement> requirements = new ArrayList<>();

        for (SourceUnit unit : parsed.units()) {
            Classification category = classifier.classify(unit);
            if (category == Classification.UNKNOWN) {
                Gap gap = unclassifiedGap(unit);
                log.warn("{}: {}", gap.unit().describe(), gap.reason());
                gaps.add(gap);
                continue;
            }

            MappingOutcome outcome = mappingEngine.map(unit, category);
            if (outcome instanceof MappingOutcome.Mapped mapped) {
                tasks.add(profileResolver.resolve(mapped.task()));
                requirements.addAll(mapped.task().requirements());
            } else if (outcome instanceof MappingOutcome.NoMatch noMatch) {
                log.warn("{}: {}", unit.reference().describe(), noMatch.reason());
                gaps.add(Gap.of(unit.reference(), GapType.NO_MATCH, noMatch.reason(), noMatch.remediation()));
            }
        }

        return new SourceIntent(parsed.sourceName(), parser.getSourceKind(), tasks, gaps, parsed.inputs(), requirements);
    }

    private static Gap unclassifiedGap(SourceUnit unit) {
        String reason = switch (unit.shape()) {
            case MALFORMED -> "Malformed statement could not be parsed";
            case UNRECOGNIZED -> "Statement form is not recognized";
            default -> "No classifier matches '" + unit.identifier() + "' (" + unit.shape().name().toLowerCase(Locale.ROOT) + ")";
        };
        return Gap.of(unit.reference(), GapType.UNCLASSIFIED, reason,
            "Review the original line manually or add a classification matcher and rule for it");
    }

    private static Gap structuralGap(String sourceName, String location, String reason, String remediation) {
        return Gap.of(new UnitReference(sourceName, location, ""), GapType.STRUCTURAL, reason, remediation);
    }
}
