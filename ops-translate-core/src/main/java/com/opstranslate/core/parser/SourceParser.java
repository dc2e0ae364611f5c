package com.opstranslate.core.parser;

import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceKind;

/**
 * Parser that turns one source document into an ordered list of source units.
 *
 * <p>Parsers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #supports(SourceDocument)}. A parser is a pure function of the document text:
 * it holds no mutable state and may be called concurrently for different documents.
 *
 * <p>Unrecognized or malformed units never abort a parse. They are returned as opaque
 * units so that later stages report them as gaps. Only a document that cannot be read
 * as a whole raises {@link StructuralParseException}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.opstranslate.core.parser.SourceParser}
 *
 * @see ParsedSource
 * @see SourceParserRegistry
 */
public interface SourceParser {

    /**
     * Returns unique identifier for this parser.
     *
     * <p>Should be kebab-case (e.g., "powercli-script", "vro-workflow").
     *
     * @return unique parser identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this parser.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the kind of source this parser reads.
     *
     * @return script or workflow
     */
    SourceKind getSourceKind();

    /**
     * Checks whether this parser can read the given document.
     *
     * @param document document to check
     * @return true if this parser handles it
     */
    boolean supports(SourceDocument document);

    /**
     * Parses the document into units in execution order.
     *
     * @param document document to parse
     * @return parsed units and declared inputs
     * @throws StructuralParseException if the document as a whole cannot be parsed
     */
    ParsedSource parse(SourceDocument document) throws StructuralParseException;
}
