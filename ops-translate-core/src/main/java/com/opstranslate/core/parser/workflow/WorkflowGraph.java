package com.opstranslate.core.parser.workflow;

import com.opstranslate.core.graph.GraphEdge;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.SourceUnit;

import java.util.List;
import java.util.Objects;

/**
 * Unordered workflow graph: nodes in document order plus the declared edges.
 *
 * @param sourceName document name
 * @param rootName name of the item the workflow starts at, or null if not declared
 * @param nodes graph nodes in document order
 * @param edges dependencies between node locations
 * @param inputs declared workflow inputs
 */
public record WorkflowGraph(
    String sourceName,
    String rootName,
    List<SourceUnit> nodes,
    List<GraphEdge> edges,
    List<InputDefinition> inputs
) {
    /**
     * Compact constructor with validation.
     */
    public WorkflowGraph {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
