package com.dcruver.notegraph.identity;

import lombok.Value;

/**
 * A page sits in the namespace named by one of its prefix segments
 */
@Value
public class NamespaceLink {
    String page;
    String namespace;
}
