package com.opstranslate.core.pipeline;

import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.SourceIntent;

import java.util.List;
import java.util.Objects;

/**
 * Outcomes of a multi-document run, in input order.
 *
 * @param outcomes one outcome per submitted document
 */
public record RunReport(
    List<TranslationOutcome> outcomes
) {
    /**
     * Compact constructor with validation.
     */
    public RunReport {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        outcomes = List.copyOf(outcomes);
    }

    public List<SourceIntent> intents() {
        return outcomes.stream()
            .filter(outcome -> outcome.status() == TranslationOutcome.Status.TRANSLATED)
            .map(TranslationOutcome::intent)
            .toList();
    }

    public List<Gap> failures() {
        return outcomes.stream()
            .filter(outcome -> outcome.status() == TranslationOutcome.Status.FAILED)
            .map(TranslationOutcome::failure)
            .toList();
    }

    public List<String> skipped() {
        return outcomes.stream()
            .filter(outcome -> outcome.status() == TranslationOutcome.Status.SKIPPED)
            .map(TranslationOutcome::sourceName)
            .toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> outcome.status() == TranslationOutcome.Status.FAILED);
    }
}
