package com.dcruver.notegraph.domain;

import lombok.Value;

/**
 * A note left out of the graph, with the reason it was dropped.
 */
@Value
public class SkippedNote {
    String path;
    String reason;
}
