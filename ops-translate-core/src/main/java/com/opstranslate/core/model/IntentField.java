package com.opstranslate.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed set of requirement fields a source can declare, each bound to its merge strategy.
 *
 * <p>The strategy is fixed by field identity so that merging never depends on the caller.
 * Rule tables refer to fields by {@link #key()}.
 */
public enum IntentField {
    CPU_COUNT("cpu_count", MergeStrategy.MAXIMUM),
    MEMORY_GB("memory_gb", MergeStrategy.MAXIMUM),
    DISK_GB("disk_gb", MergeStrategy.MAXIMUM),
    APPROVAL_REQUIRED("approval_required", MergeStrategy.MOST_RESTRICTIVE),
    CHANGE_TICKET_REQUIRED("change_ticket_required", MergeStrategy.MOST_RESTRICTIVE),
    SNAPSHOT_REQUIRED("snapshot_required", MergeStrategy.MOST_RESTRICTIVE),
    TAGS("tags", MergeStrategy.UNION),
    TARGET_NETWORK("target_network", MergeStrategy.EXPLICIT_CONFLICT),
    TARGET_NAMESPACE("target_namespace", MergeStrategy.EXPLICIT_CONFLICT),
    STORAGE_CLASS("storage_class", MergeStrategy.EXPLICIT_CONFLICT),
    MAX_CPU("max_cpu", MergeStrategy.MINIMUM),
    MAX_MEMORY_GB("max_memory_gb", MergeStrategy.MINIMUM),
    MAX_STORAGE_GB("max_storage_gb", MergeStrategy.MINIMUM),
    APPROVERS("approvers", MergeStrategy.UNION),
    LABELS("labels", MergeStrategy.UNION),
    WORKLOAD_TYPE("workload_type", MergeStrategy.MIXED);

    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private final String key;
    private final MergeStrategy strategy;

    IntentField(String key, MergeStrategy strategy) {
        this.key = key;
        this.strategy = strategy;
    }

    public String key() {
        return key;
    }

    public MergeStrategy strategy() {
        return strategy;
    }

    /**
     * Looks up a field by its rule-table key.
     *
     * @param key field key such as {@code "cpu_count"}
     * @return the field, or empty if the key is not part of the closed set
     */
    public static Optional<IntentField> fromKey(String key) {
        for (IntentField field : values()) {
            if (field.key.equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up the field a declared input name stands for.
     *
     * <p>Camel-case and Pascal-case names are converted to snake case first, so
     * {@code CpuCount}, {@code cpuCount} and {@code cpu_count} all name {@link #CPU_COUNT}.
     *
     * @param inputName input name as declared in the source
     * @return the field, or empty if the name is not a field key
     */
    public static Optional<IntentField> fromInputName(String inputName) {
        String key = WORD_BOUNDARY.matcher(inputName.strip()).replaceAll("_").toLowerCase(Locale.ROOT);
        return fromKey(key);
    }
}
