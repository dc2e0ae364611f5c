package com.opstranslate.core.graph;

/**
 * Kind of dependency declared between two workflow graph nodes.
 */
public enum EdgeType {
    /** Normal successor ({@code out-name}). */
    NEXT,

    /** Alternate decision branch ({@code alt-out-name}). */
    ALTERNATE,

    /** Exception handler path ({@code catch-name}). */
    EXCEPTION
}
