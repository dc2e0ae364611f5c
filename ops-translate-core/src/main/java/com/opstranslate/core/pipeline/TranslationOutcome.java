package com.opstranslate.core.pipeline;

import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.SourceIntent;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of translating one document.
 *
 * @param sourceName document name
 * @param status translated, failed or skipped
 * @param intent source intent, present only when translated
 * @param failure structural gap, present only when failed
 */
public record TranslationOutcome(
    String sourceName,
    Status status,
    SourceIntent intent,
    Gap failure
) {
    /**
     * Per-document status.
     */
    public enum Status {
        /** Translated into a source intent; may still contain gaps and blocked tasks. */
        TRANSLATED,
        /** Structural failure; the document contributes no intent. */
        FAILED,
        /** Cancelled before completion; not a failure of the run. */
        SKIPPED
    }

    /**
     * Compact constructor with validation.
     */
    public TranslationOutcome {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.TRANSLATED && intent == null) {
            throw new IllegalArgumentException("translated outcome requires an intent");
        }
        if (status == Status.FAILED && failure == null) {
            throw new IllegalArgumentException("failed outcome requires a failure gap");
        }
    }

    public static TranslationOutcome translated(SourceIntent intent) {
        return new TranslationOutcome(intent.sourceName(), Status.TRANSLATED, intent, null);
    }

    public static TranslationOutcome failed(String sourceName, Gap failure) {
        return new TranslationOutcome(sourceName, Status.FAILED, null, failure);
    }

    public static TranslationOutcome skipped(String sourceName) {
        return new TranslationOutcome(sourceName, Status.SKIPPED, null, null);
    }

    public Optional<SourceIntent> intentIfTranslated() {
        return Optional.ofNullable(intent);
    }
}
