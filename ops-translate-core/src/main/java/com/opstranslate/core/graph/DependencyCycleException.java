package com.opstranslate.core.graph;

import com.opstranslate.core.parser.StructuralParseException;

import java.util.List;

/**
 * Thrown when a workflow graph contains a dependency cycle. Fatal for that document only.
 */
public class DependencyCycleException extends StructuralParseException {

    private final List<String> cycleNodes;

    public DependencyCycleException(String sourceName, List<String> cycleNodes) {
        super(sourceName, "dependency cycle between " + String.join(", ", cycleNodes));
        this.cycleNodes = List.copyOf(cycleNodes);
    }

    /**
     * Returns the nodes that could not be ordered, in document order.
     *
     * @return node locations left with unsatisfied dependencies
     */
    public List<String> getCycleNodes() {
        return cycleNodes;
    }
}
