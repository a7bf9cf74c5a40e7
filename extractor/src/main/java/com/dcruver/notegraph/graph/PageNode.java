package com.dcruver.notegraph.graph;

import lombok.Value;

@Value
public class PageNode {
    String name;
    boolean isPlaceholder;
    boolean isPublic;
}
