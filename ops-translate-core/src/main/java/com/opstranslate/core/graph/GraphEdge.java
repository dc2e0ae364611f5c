package com.opstranslate.core.graph;

import java.util.Objects;

/**
 * Directed dependency between two workflow graph nodes: {@code from} must run before {@code to}.
 *
 * <p>Edges only drive ordering and are discarded afterwards.
 *
 * @param from location of the predecessor node
 * @param to location of the successor node
 * @param type edge kind
 */
public record GraphEdge(
    String from,
    String to,
    EdgeType type
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
