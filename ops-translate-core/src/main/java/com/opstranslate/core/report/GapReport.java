package com.opstranslate.core.report;

import com.opstranslate.core.model.ConflictRecord;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.GapSeverity;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.pipeline.RunReport;
import com.opstranslate.core.pipeline.TranslationOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Structured list of everything an operator must review after a run: unknown units,
 * unmatched units, blocked tasks, merge conflicts, structural failures and skipped files.
 *
 * @param entries report entries, grouped by source in run order
 */
public record GapReport(
    List<Entry> entries
) {
    /**
     * One reviewable item.
     *
     * @param type gap category
     * @param severity severity
     * @param reference {@code source:location}, or the conflict subject
     * @param reason what went wrong
     * @param remediation what to do about it
     * @param evidence original source text, empty when not applicable
     */
    public record Entry(
        GapType type,
        GapSeverity severity,
        String reference,
        String reason,
        String remediation,
        String evidence
    ) {
        /**
         * Compact constructor with validation.
         */
        public Entry {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(severity, "severity must not be null");
            Objects.requireNonNull(reference, "reference must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
            remediation = remediation == null ? "" : remediation;
            evidence = evidence == null ? "" : evidence;
        }
    }

    /**
     * Compact constructor with validation.
     */
    public GapReport {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    /**
     * Builds the report of a run.
     *
     * @param run per-document outcomes
     * @param merged merged intent, or null when no merge was performed
     * @return gap report
     */
    public static GapReport of(RunReport run, MergedIntent merged) {
        List<Entry> entries = new ArrayList<>();
        for (TranslationOutcome outcome : run.outcomes()) {
            switch (outcome.status()) {
                case TRANSLATED -> entries.addAll(entriesFor(outcome.intent()));
                case FAILED -> entries.add(entry(outcome.failure()));
                case SKIPPED -> entries.add(new Entry(GapType.SKIPPED, GapType.SKIPPED.defaultSeverity(),
                    outcome.sourceName(), "Translation was cancelled", "Re-run the file to translate it", ""));
                default -> throw new IllegalStateException("unhandled status " + outcome.status());
            }
        }
        if (merged != null) {
            merged.conflicts().forEach(conflict -> entries.add(entry(conflict)));
        }
        return new GapReport(entries);
    }

    /**
     * Builds the report of a single source intent.
     *
     * @param intent source intent
     * @return gap report
     */
    public static GapReport of(SourceIntent intent) {
        return new GapReport(entriesFor(intent));
    }

    /**
     * Counts entries per type, in type declaration order.
     *
     * @return counts including zero counts
     */
    public Map<GapType, Long> countsByType() {
        Map<GapType, Long> counts = new EnumMap<>(GapType.class);
        for (GapType type : GapType.values()) {
            counts.put(type, 0L);
        }
        entries.forEach(entry -> counts.merge(entry.type(), 1L, Long::sum));
        return counts;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    // ==================== Entry Builders ====================

    private static List<Entry> entriesFor(SourceIntent intent) {
        List<Entry> entries = new ArrayList<>();
        intent.gaps().forEach(gap -> entries.add(entry(gap)));
        for (ResolvedTask task : intent.blockedTasks()) {
            entries.add(new Entry(GapType.BLOCKED, GapType.BLOCKED.defaultSeverity(), task.unit().describe(),
                "'" + task.name() + "' is blocked: missing " + String.join(", ", task.missingProfilePaths()),
                task.blockedReason(), task.unit().rawText()));
        }
        return entries;
    }

    private static Entry entry(Gap gap) {
        return new Entry(gap.type(), gap.severity(), gap.unit().describe(), gap.reason(), gap.remediation(),
            gap.unit().rawText());
    }

    private static Entry entry(ConflictRecord conflict) {
        List<String> values = new ArrayList<>();
        conflict.valuesBySource().forEach((value, sources) -> values.add(value + " (" + String.join(", ", sources) + ")"));
        return new Entry(GapType.MERGE_CONFLICT, GapType.MERGE_CONFLICT.defaultSeverity(), conflict.subject(),
            conflict.type().name().toLowerCase(Locale.ROOT) + ": " + String.join(" vs ", values),
            conflict.remediation(), "");
    }
}
