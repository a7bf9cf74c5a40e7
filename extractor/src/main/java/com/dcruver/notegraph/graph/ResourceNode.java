package com.dcruver.notegraph.graph;

import lombok.Value;

@Value
public class ResourceNode {
    String path;
    boolean isAsset;
}
