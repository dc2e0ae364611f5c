package com.opstranslate.core.model;

/**
 * Severity level for gaps reported during translation.
 */
public enum GapSeverity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - part of the source was not translated and needs review.
     */
    WARNING,

    /**
     * Error - a whole source document could not be translated.
     */
    ERROR
}
