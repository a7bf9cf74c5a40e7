package com.dcruver.notegraph.graph;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Relationship tables, with the node kinds each one may connect and its payload columns.
 */
public enum RelationshipType {
    IN_NAMESPACE("InNamespace", EnumSet.of(NodeKind.PAGE), NodeKind.PAGE, List.of()),
    HOLDS("Holds", EnumSet.of(NodeKind.PAGE, NodeKind.BLOCK), NodeKind.BLOCK, List.of("position", "depth")),
    LINKS("Links", EnumSet.of(NodeKind.BLOCK), NodeKind.PAGE, List.of()),
    LINKS_AS_TAG("LinksAsTag", EnumSet.of(NodeKind.BLOCK), NodeKind.PAGE, List.of()),
    LINKS_TO_BLOCK("LinksToBlock", EnumSet.of(NodeKind.BLOCK), NodeKind.BLOCK, List.of()),
    LINKS_TO_RESOURCE("LinksToResource", EnumSet.of(NodeKind.BLOCK), NodeKind.RESOURCE, List.of("label")),
    HAS_PROPERTY("HasProperty", EnumSet.of(NodeKind.PAGE, NodeKind.BLOCK), NodeKind.PAGE, List.of("value")),
    IS_TAGGED("IsTagged", EnumSet.of(NodeKind.PAGE, NodeKind.BLOCK), NodeKind.PAGE, List.of());

    private final String tableName;
    private final Set<NodeKind> sourceKinds;
    private final NodeKind targetKind;
    private final List<String> payloadColumns;

    RelationshipType(String tableName, Set<NodeKind> sourceKinds, NodeKind targetKind, List<String> payloadColumns) {
        this.tableName = tableName;
        this.sourceKinds = sourceKinds;
        this.targetKind = targetKind;
        this.payloadColumns = payloadColumns;
    }

    public String getTableName() {
        return tableName;
    }

    public boolean allowsSource(NodeKind kind) {
        return sourceKinds.contains(kind);
    }

    /**
     * True when rows of this table can start at more than one node table
     */
    public boolean hasMixedSources() {
        return sourceKinds.size() > 1;
    }

    public NodeKind getTargetKind() {
        return targetKind;
    }

    public List<String> getPayloadColumns() {
        return payloadColumns;
    }
}
