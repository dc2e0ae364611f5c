package com.opstranslate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Normalized translation of one source document.
 *
 * <p>Every unit the parser produced appears exactly once: as a resolved task, a blocked
 * task, or a gap. Tasks keep unit order (source order for scripts, dependency order for
 * workflows).
 *
 * @param sourceName document name, unique within a run
 * @param kind script or workflow
 * @param tasks resolved and blocked tasks in unit order
 * @param gaps unclassified and unmapped units in unit order
 * @param inputs declared inputs in declaration order
 * @param requirements requirement values recorded by mapping rules, in unit order
 */
public record SourceIntent(
    String sourceName,
    SourceKind kind,
    List<ResolvedTask> tasks,
    List<Gap> gaps,
    List<InputDefinition> inputs,
    List<Requirement> requirements
) {
    /**
     * Compact constructor with validation.
     */
    public SourceIntent {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    /**
     * Returns the blocked tasks in unit order.
     *
     * @return blocked tasks
     */
    public List<ResolvedTask> blockedTasks() {
        return tasks.stream().filter(ResolvedTask::isBlocked).toList();
    }

    /**
     * Returns how many source units this intent accounts for.
     *
     * @return tasks plus gaps
     */
    public int unitCount() {
        return tasks.size() + gaps.size();
    }
}
