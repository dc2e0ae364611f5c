package com.opstranslate.core.model;

/**
 * Whether a {@link SourceUnit} came from a script line or a workflow graph node.
 */
public enum UnitKind {
    STATEMENT,
    GRAPH_NODE
}
