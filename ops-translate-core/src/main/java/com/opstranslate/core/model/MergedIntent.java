package com.opstranslate.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reconciled combination of every {@link SourceIntent} of a run.
 *
 * <p>A merged intent with conflicts is valid but flagged: emitting it requires an explicit
 * acknowledgement from the caller.
 *
 * @param sources source names, sorted
 * @param inputs unified inputs keyed by name, sorted
 * @param fields merged requirement values in field declaration order; conflicted fields are absent
 * @param conflicts conflict records, sorted by subject
 * @param tasksBySource tasks of each source keyed by source name, sorted
 * @param gaps gaps of all sources, grouped by source name in sorted order
 */
public record MergedIntent(
    List<String> sources,
    Map<String, InputDefinition> inputs,
    Map<IntentField, Object> fields,
    List<ConflictRecord> conflicts,
    Map<String, List<ResolvedTask>> tasksBySource,
    List<Gap> gaps
) {
    /**
     * Compact constructor with validation and defensive copies.
     */
    public MergedIntent {
        Objects.requireNonNull(sources, "sources must not be null");
        sources = List.copyOf(sources);
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(inputs));
        EnumMap<IntentField, Object> orderedFields = new EnumMap<>(IntentField.class);
        if (fields != null) {
            orderedFields.putAll(fields);
        }
        fields = Collections.unmodifiableMap(orderedFields);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        Map<String, List<ResolvedTask>> orderedTasks = new TreeMap<>();
        if (tasksBySource != null) {
            tasksBySource.forEach((source, tasks) -> orderedTasks.put(source, List.copyOf(tasks)));
        }
        tasksBySource = Collections.unmodifiableMap(orderedTasks);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Returns all tasks, sources in sorted order and tasks in unit order within a source.
     *
     * @return flattened task list
     */
    public List<ResolvedTask> allTasks() {
        return tasksBySource.values().stream().flatMap(List::stream).toList();
    }

    /**
     * Returns merged field values keyed by their rule-table key.
     *
     * @return ordered key to value map
     */
    public Map<String, Object> fieldsByKey() {
        Map<String, Object> byKey = new LinkedHashMap<>();
        fields.forEach((field, value) -> byKey.put(field.key(), value));
        return byKey;
    }
}
