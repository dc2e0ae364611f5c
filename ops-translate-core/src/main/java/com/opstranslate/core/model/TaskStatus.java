package com.opstranslate.core.model;

/**
 * Outcome of profile resolution for a mapped task.
 */
public enum TaskStatus {
    /** Every required profile path was present. */
    RESOLVED,

    /** At least one required profile path was absent; the task carries remediation text. */
    BLOCKED
}
