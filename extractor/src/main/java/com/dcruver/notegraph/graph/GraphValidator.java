package com.dcruver.notegraph.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Checks the invariants a finished graph must satisfy before anyone may load it:
 * every relationship endpoint exists with the kind its type allows, and Holds edges
 * form a tree in which every block has exactly one parent one level up.
 */
@Component
@Slf4j
public class GraphValidator {

    public void validate(NoteGraph graph) {
        List<String> violations = new ArrayList<>();

        Set<NodeRef> nodes = new HashSet<>();
        graph.getPages().forEach(p -> nodes.add(NodeRef.page(p.getName())));
        graph.getResources().forEach(r -> nodes.add(NodeRef.resource(r.getPath())));
        Map<UUID, BlockNode> blocks = new HashMap<>();
        for (BlockNode block : graph.getBlocks()) {
            nodes.add(NodeRef.block(block.getUuid()));
            blocks.put(block.getUuid(), block);
        }

        Map<String, Integer> parentCount = new HashMap<>();

        for (Relationship rel : graph.getRelationships()) {
            RelationshipType type = rel.getType();

            if (!type.allowsSource(rel.getSource().getKind())) {
                violations.add(type.getTableName() + " cannot start at " + rel.getSource());
            } else if (!nodes.contains(rel.getSource())) {
                violations.add(type.getTableName() + " source missing: " + rel.getSource());
            }

            if (rel.getTarget().getKind() != type.getTargetKind()) {
                violations.add(type.getTableName() + " cannot end at " + rel.getTarget());
            } else if (!nodes.contains(rel.getTarget())) {
                violations.add(type.getTableName() + " target missing: " + rel.getTarget());
            }

            if (type == RelationshipType.HOLDS && rel.getTarget().getKind() == NodeKind.BLOCK) {
                parentCount.merge(rel.getTarget().getId(), 1, Integer::sum);
                checkDepth(rel, blocks, violations);
            }
        }

        for (BlockNode block : graph.getBlocks()) {
            int parents = parentCount.getOrDefault(block.getUuid().toString(), 0);
            if (parents != 1) {
                violations.add("Block " + block.getUuid() + " has " + parents + " Holds parents");
            }
        }

        if (!violations.isEmpty()) {
            log.error("Graph failed consistency validation with {} violation(s)", violations.size());
            throw new GraphConsistencyException(violations);
        }

        log.debug("Graph passed consistency validation");
    }

    private void checkDepth(Relationship rel, Map<UUID, BlockNode> blocks, List<String> violations) {
        BlockNode child = blocks.get(UUID.fromString(rel.getTarget().getId()));
        if (child == null) {
            return;
        }

        int expected = 0;
        if (rel.getSource().getKind() == NodeKind.BLOCK) {
            BlockNode parent = blocks.get(UUID.fromString(rel.getSource().getId()));
            if (parent == null) {
                return;
            }
            expected = parent.getDepth() + 1;
        }

        if (rel.getDepth() == null || rel.getDepth() != expected || child.getDepth() != expected) {
            violations.add("Holds " + rel.getSource() + " -> " + rel.getTarget()
                + " has depth " + rel.getDepth() + ", expected " + expected);
        }
    }
}
