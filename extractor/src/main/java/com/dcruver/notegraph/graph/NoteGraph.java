package com.dcruver.notegraph.graph;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The finished, immutable result of one extraction run: node tables and relationship table.
 * Lists are ordered deterministically so two runs over the same notes compare equal.
 */
@Value
public class NoteGraph {
    List<PageNode> pages;        // by name
    List<BlockNode> blocks;      // by note, then outline order
    List<ResourceNode> resources;  // by path
    List<Relationship> relationships;  // sorted

    public NoteGraph(List<PageNode> pages, List<BlockNode> blocks, List<ResourceNode> resources,
                     List<Relationship> relationships) {
        this.pages = List.copyOf(pages);
        this.blocks = List.copyOf(blocks);
        this.resources = List.copyOf(resources);
        this.relationships = List.copyOf(relationships);
    }

    public Optional<PageNode> page(String name) {
        return pages.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Optional<BlockNode> block(UUID uuid) {
        return blocks.stream().filter(b -> b.getUuid().equals(uuid)).findFirst();
    }

    public Optional<ResourceNode> resource(String path) {
        return resources.stream().filter(r -> r.getPath().equals(path)).findFirst();
    }

    public List<Relationship> relationshipsOf(RelationshipType type) {
        return relationships.stream().filter(r -> r.getType() == type).toList();
    }

    public Map<RelationshipType, Integer> countByType() {
        Map<RelationshipType, Integer> counts = new EnumMap<>(RelationshipType.class);
        for (RelationshipType type : RelationshipType.values()) {
            counts.put(type, 0);
        }
        for (Relationship relationship : relationships) {
            counts.merge(relationship.getType(), 1, Integer::sum);
        }
        return counts;
    }

    public long placeholderCount() {
        return pages.stream().filter(PageNode::isPlaceholder).count();
    }
}
