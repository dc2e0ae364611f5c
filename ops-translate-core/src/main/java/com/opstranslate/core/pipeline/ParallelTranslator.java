package com.opstranslate.core.pipeline;

import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.UnitReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the translation pipeline for many documents on a fixed thread pool.
 *
 * <p>Documents share nothing but the immutable pipeline, so no synchronization is needed
 * until results are collected. Each document can be cancelled on its own; a cancelled
 * document is reported as skipped.
 */
public final class ParallelTranslator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelTranslator.class);

    private final TranslationPipeline pipeline;
    private final ExecutorService executor;

    public ParallelTranslator(TranslationPipeline pipeline, int parallelism) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
    }

    /**
     * Translates all documents and waits for the result.
     *
     * @param documents documents with unique names
     * @return outcomes in input order
     */
    public RunReport translateAll(List<SourceDocument> documents) {
        return submit(documents).awaitReport();
    }

    /**
     * Starts translating the documents without waiting.
     *
     * @param documents documents with unique names
     * @return handle for cancelling documents and collecting the report
     * @throws IllegalArgumentException if two documents share a name
     */
    public TranslationRun submit(List<SourceDocument> documents) {
        Map<String, Future<TranslationOutcome>> futures = new LinkedHashMap<>();
        for (SourceDocument document : documents) {
            if (futures.containsKey(document.name())) {
                throw new IllegalArgumentException("duplicate document name: " + document.name());
            }
            futures.put(document.name(), executor.submit(() -> pipeline.translate(document)));
        }
        log.info("Submitted {} documents for translation", futures.size());
        return new TranslationRun(futures);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * In-flight run of several documents.
     */
    public static final class TranslationRun {

        private final Map<String, Future<TranslationOutcome>> futures;

        private TranslationRun(Map<String, Future<TranslationOutcome>> futures) {
            this.futures = futures;
        }

        /**
         * Cancels one document. Other documents are unaffected.
         *
         * @param sourceName document name
         * @return true if the document was cancelled before it completed
         */
        public boolean cancel(String sourceName) {
            Future<TranslationOutcome> future = futures.get(sourceName);
            if (future == null) {
                return false;
            }
            boolean cancelled = future.cancel(true);
            if (cancelled) {
                log.info("Cancelled translation of {}", sourceName);
            }
            return cancelled;
        }

        /**
         * Waits for every document and collects the outcomes in submission order.
         *
         * @return run report
         */
        public RunReport awaitReport() {
            List<TranslationOutcome> outcomes = new ArrayList<>(futures.size());
            for (Map.Entry<String, Future<TranslationOutcome>> entry : futures.entrySet()) {
                outcomes.add(await(entry.getKey(), entry.getValue()));
            }
            return new RunReport(outcomes);
        }

        private TranslationOutcome await(String sourceName, Future<TranslationOutcome> future) {
            try {
                return future.get();
            } catch (CancellationException e) {
                return TranslationOutcome.skipped(sourceName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("Interrupted while waiting for {}; reported as skipped", sourceName);
                return TranslationOutcome.skipped(sourceName);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Unexpected error translating {}", sourceName, cause);
                return TranslationOutcome.failed(sourceName, Gap.of(
                    new UnitReference(sourceName, "document", ""),
                    GapType.STRUCTURAL,
                    "Unexpected error: " + cause.getMessage(),
                    "Report this document; the rest of the run is unaffected"));
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "ops-translate-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
