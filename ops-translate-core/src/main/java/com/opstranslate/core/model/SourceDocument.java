package com.opstranslate.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A source file already located and read by the caller.
 *
 * <p>The core never touches the filesystem to discover documents; the CLI layer hands
 * them over as name plus content.
 *
 * @param name file name used in every unit reference (e.g. {@code "provision.ps1"})
 * @param content full document text
 */
public record SourceDocument(
    String name,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public SourceDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns the lowercase file extension without the dot.
     *
     * @return extension, or empty string if the name has none
     */
    public String extension() {
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
