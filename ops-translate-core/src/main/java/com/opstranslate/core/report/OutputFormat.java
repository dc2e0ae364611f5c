package com.opstranslate.core.report;

import java.util.Locale;

/**
 * Text format of serialized intents and reports.
 */
public enum OutputFormat {
    YAML("yaml"),
    JSON("json");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Parses a format name, ignoring case; {@code yml} is accepted for YAML.
     *
     * @param value format name
     * @return format
     * @throws IllegalArgumentException for unknown names
     */
    public static OutputFormat fromString(String value) {
        String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "yaml", "yml" -> YAML;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unknown output format: " + value);
        };
    }
}
