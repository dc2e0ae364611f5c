package com.opstranslate.core.pipeline;

import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.parser.ParsedSource;
import com.opstranslate.core.parser.SourceParser;
import com.opstranslate.core.parser.SourceParserRegistry;
import com.opstranslate.core.profile.Profile;
import com.opstranslate.core.rules.RuleTableLoader;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ParallelTranslator}.
 */
class ParallelTranslatorTest {

    @Test
    void translateAll_mixedDocuments_reportsInInputOrder() {
        // Given
        List<SourceDocument> documents = List.of(
            new SourceDocument("c.ps1", "Start-VM -VM web01"),
            new SourceDocument("a.txt", "not a source"),
            new SourceDocument("b.ps1", "Stop-VM -VM web01"));

        // When
        RunReport report;
        try (ParallelTranslator translator = new ParallelTranslator(defaultPipeline(), 3)) {
            report = translator.translateAll(documents);
        }

        // Then
        assertThat(report.outcomes()).extracting(TranslationOutcome::sourceName)
            .containsExactly("c.ps1", "a.txt", "b.ps1");
        assertThat(report.intents()).hasSize(2);
        assertThat(report.failures()).hasSize(1);
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.skipped()).isEmpty();
    }

    @Test
    void cancel_queuedDocument_isReportedSkippedWithoutAffectingOthers() throws InterruptedException {
        // Given: one worker, held busy by the first document
        BlockingParser parser = new BlockingParser();
        TranslationPipeline pipeline = new TranslationPipeline(new RuleTableLoader().loadDefault(),
            Profile.empty("profile"), new SourceParserRegistry(List.of(parser)));

        try (ParallelTranslator translator = new ParallelTranslator(pipeline, 1)) {
            ParallelTranslator.TranslationRun run = translator.submit(List.of(
                new SourceDocument("first.slow", ""),
                new SourceDocument("second.slow", ""),
                new SourceDocument("third.slow", "")));
            assertThat(parser.started.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            boolean cancelled = run.cancel("second.slow");
            parser.release.countDown();
            RunReport report = run.awaitReport();

            // Then
            assertThat(cancelled).isTrue();
            assertThat(report.outcomes()).extracting(TranslationOutcome::status).containsExactly(
                TranslationOutcome.Status.TRANSLATED,
                TranslationOutcome.Status.SKIPPED,
                TranslationOutcome.Status.TRANSLATED);
            assertThat(report.skipped()).containsExactly("second.slow");
        }
    }

    @Test
    void cancel_unknownDocument_returnsFalse() {
        try (ParallelTranslator translator = new ParallelTranslator(defaultPipeline(), 1)) {
            ParallelTranslator.TranslationRun run = translator.submit(List.of());

            assertThat(run.cancel("missing.ps1")).isFalse();
            assertThat(run.awaitReport().outcomes()).isEmpty();
        }
    }

    @Test
    void submit_duplicateNames_throwsIllegalArgument() {
        try (ParallelTranslator translator = new ParallelTranslator(defaultPipeline(), 2)) {
            List<SourceDocument> documents = List.of(
                new SourceDocument("a.ps1", ""), new SourceDocument("a.ps1", ""));

            assertThatThrownBy(() -> translator.submit(documents))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a.ps1");
        }
    }

    @Test
    void constructor_zeroParallelism_throwsIllegalArgument() {
        TranslationPipeline pipeline = defaultPipeline();

        assertThatThrownBy(() -> new ParallelTranslator(pipeline, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static TranslationPipeline defaultPipeline() {
        return new TranslationPipeline(new RuleTableLoader().loadDefault(), Profile.empty("profile"),
            SourceParserRegistry.discover());
    }

    /**
     * Parser that blocks the first document until released.
     */
    private static final class BlockingParser implements SourceParser {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public String getId() {
            return "blocking";
        }

        @Override
        public String getDisplayName() {
            return "Blocking Parser";
        }

        @Override
        public SourceKind getSourceKind() {
            return SourceKind.SCRIPT;
        }

        @Override
        public boolean supports(SourceDocument document) {
            return document.name().endsWith(".slow");
        }

        @Override
        public ParsedSource parse(SourceDocument document) {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ParsedSource(document.name(), SourceKind.SCRIPT, List.of(), List.of());
        }
    }
}
