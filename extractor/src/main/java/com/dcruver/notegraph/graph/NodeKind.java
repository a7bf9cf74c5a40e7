package com.dcruver.notegraph.graph;

/**
 * Node tables of the emitted graph.
 */
public enum NodeKind {
    PAGE,
    BLOCK,
    RESOURCE
}
