package com.dcruver.notegraph.graph;

import lombok.Value;

import java.util.Comparator;

/**
 * A typed edge between two nodes. Payload fields not used by the type stay null.
 * Equality is structural, which is what relationship deduplication relies on.
 */
@Value
public class Relationship implements Comparable<Relationship> {

    private static final Comparator<Relationship> ORDER = Comparator
        .comparing(Relationship::getType)
        .thenComparing(Relationship::getSource)
        .thenComparing(Relationship::getTarget)
        .thenComparing(Relationship::getPosition, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Relationship::getDepth, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Relationship::getLabel, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Relationship::getValue, Comparator.nullsFirst(Comparator.naturalOrder()));

    RelationshipType type;
    NodeRef source;
    NodeRef target;

    Integer position;
    Integer depth;
    String label;
    String value;

    public static Relationship inNamespace(String page, String namespace) {
        return new Relationship(RelationshipType.IN_NAMESPACE, NodeRef.page(page), NodeRef.page(namespace),
            null, null, null, null);
    }

    public static Relationship holds(NodeRef parent, NodeRef child, int position, int depth) {
        return new Relationship(RelationshipType.HOLDS, parent, child, position, depth, null, null);
    }

    public static Relationship links(NodeRef block, String page) {
        return new Relationship(RelationshipType.LINKS, block, NodeRef.page(page), null, null, null, null);
    }

    public static Relationship linksAsTag(NodeRef block, String page) {
        return new Relationship(RelationshipType.LINKS_AS_TAG, block, NodeRef.page(page), null, null, null, null);
    }

    public static Relationship linksToBlock(NodeRef block, NodeRef target) {
        return new Relationship(RelationshipType.LINKS_TO_BLOCK, block, target, null, null, null, null);
    }

    public static Relationship linksToResource(NodeRef block, String path, String label) {
        return new Relationship(RelationshipType.LINKS_TO_RESOURCE, block, NodeRef.resource(path),
            null, null, label, null);
    }

    public static Relationship hasProperty(NodeRef owner, String key, String value) {
        return new Relationship(RelationshipType.HAS_PROPERTY, owner, NodeRef.page(key), null, null, null, value);
    }

    public static Relationship isTagged(NodeRef owner, String tag) {
        return new Relationship(RelationshipType.IS_TAGGED, owner, NodeRef.page(tag), null, null, null, null);
    }

    @Override
    public int compareTo(Relationship other) {
        return ORDER.compare(this, other);
    }
}
