package com.opstranslate.core.parser.base;

import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Abstract base class for source parser implementations.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per parser class)</li>
 *   <li>Extension-based {@link #supports(SourceDocument)} driven by {@link #getSupportedExtensions()}</li>
 *   <li>Line helpers shared by the line-oriented grammars</li>
 * </ul>
 *
 * @see SourceParser
 */
public abstract class AbstractSourceParser implements SourceParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    protected AbstractSourceParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Returns lowercase file extensions (without dot) this parser reads.
     *
     * @return supported extensions
     */
    protected abstract Set<String> getSupportedExtensions();

    @Override
    public boolean supports(SourceDocument document) {
        return getSupportedExtensions().contains(document.extension());
    }

    // ==================== Line Utilities ====================

    /**
     * Splits content into lines, accepting both LF and CRLF line endings.
     *
     * @param content document text
     * @return lines without terminators
     */
    protected String[] splitLines(String content) {
        return content.split("\r?\n", -1);
    }

    /**
     * Formats a one-based line number as a unit location.
     *
     * @param lineIndex zero-based line index
     * @return location such as {@code "line 3"}
     */
    protected String lineLocation(int lineIndex) {
        return "line " + (lineIndex + 1);
    }
}
