package com.opstranslate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Target task produced by the mapping engine and completed by the profile resolver.
 *
 * <p>A task is either {@link TaskStatus#RESOLVED} or {@link TaskStatus#BLOCKED}. Blocked tasks
 * keep their intended action and partially filled parameters and add a deterministic
 * remediation text; they are never dropped.
 *
 * @param unit evidence the task was derived from
 * @param ruleId id of the mapping rule that matched
 * @param category classification of the source unit
 * @param name human-readable task name
 * @param targetAction target module or action
 * @param params resolved parameters in template order
 * @param tags task tags in rule order
 * @param status resolved or blocked
 * @param blockedReason remediation text, present only when blocked
 * @param missingProfilePaths required profile paths that were absent, empty when resolved
 */
public record ResolvedTask(
    UnitReference unit,
    String ruleId,
    Classification category,
    String name,
    String targetAction,
    Map<String, Object> params,
    List<String> tags,
    TaskStatus status,
    String blockedReason,
    List<String> missingProfilePaths
) {
    /**
     * Compact constructor with validation.
     */
    public ResolvedTask {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(targetAction, "targetAction must not be null");
        Objects.requireNonNull(status, "status must not be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        tags = tags == null ? List.of() : List.copyOf(tags);
        missingProfilePaths = missingProfilePaths == null ? List.of() : List.copyOf(missingProfilePaths);
        if (status == TaskStatus.BLOCKED && (blockedReason == null || missingProfilePaths.isEmpty())) {
            throw new IllegalArgumentException("blocked task requires a reason and at least one missing path");
        }
        if (status == TaskStatus.RESOLVED && blockedReason != null) {
            throw new IllegalArgumentException("resolved task must not carry a blocked reason");
        }
    }

    public boolean isBlocked() {
        return status == TaskStatus.BLOCKED;
    }
}
