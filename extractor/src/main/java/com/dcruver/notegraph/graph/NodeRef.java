package com.dcruver.notegraph.graph;

import lombok.Value;

import java.util.Comparator;
import java.util.UUID;

/**
 * Address of a node: its table plus its key (page name, block uuid, or resource path).
 */
@Value
public class NodeRef implements Comparable<NodeRef> {

    private static final Comparator<NodeRef> ORDER = Comparator
        .comparing(NodeRef::getKind)
        .thenComparing(NodeRef::getId);

    NodeKind kind;
    String id;

    public static NodeRef page(String name) {
        return new NodeRef(NodeKind.PAGE, name);
    }

    public static NodeRef block(UUID uuid) {
        return new NodeRef(NodeKind.BLOCK, uuid.toString());
    }

    public static NodeRef resource(String path) {
        return new NodeRef(NodeKind.RESOURCE, path);
    }

    @Override
    public int compareTo(NodeRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
