package com.dcruver.notegraph.graph;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One outline block. {@code page} and {@code parent} are kept for convenience;
 * the graph itself expresses containment through Holds relationships.
 */
@Value
@Builder
public class BlockNode {
    UUID uuid;
    String page;
    UUID parent;  // null for root blocks

    String content;
    boolean isHeading;
    String directive;

    int position;
    int depth;
}
