package com.opstranslate.core.parser;

import com.opstranslate.core.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Immutable set of source parsers, looked up by document.
 */
public final class SourceParserRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceParserRegistry.class);

    private final List<SourceParser> parsers;

    public SourceParserRegistry(List<SourceParser> parsers) {
        Objects.requireNonNull(parsers, "parsers must not be null");
        List<SourceParser> sorted = new ArrayList<>(parsers);
        sorted.sort(Comparator.comparing(SourceParser::getId));
        this.parsers = List.copyOf(sorted);
    }

    /**
     * Discovers all parsers registered through {@link ServiceLoader}.
     *
     * @return registry with every discovered parser
     */
    public static SourceParserRegistry discover() {
        List<SourceParser> found = new ArrayList<>();
        ServiceLoader.load(SourceParser.class).forEach(found::add);
        log.debug("Discovered {} source parsers", found.size());
        return new SourceParserRegistry(found);
    }

    /**
     * Finds the first parser, in id order, that supports the document.
     *
     * @param document document to parse
     * @return matching parser, or empty when none supports it
     */
    public Optional<SourceParser> parserFor(SourceDocument document) {
        return parsers.stream().filter(parser -> parser.supports(document)).findFirst();
    }

    public List<SourceParser> parsers() {
        return parsers;
    }
}
