package com.opstranslate.core.model;

/**
 * Family of source document a {@link SourceIntent} was produced from.
 */
public enum SourceKind {
    /** Imperative provisioning script, processed line by line. */
    SCRIPT,

    /** XML workflow export, processed as a dependency graph. */
    WORKFLOW
}
