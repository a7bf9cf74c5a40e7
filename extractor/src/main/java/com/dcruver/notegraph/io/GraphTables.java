package com.dcruver.notegraph.io;

import com.dcruver.notegraph.graph.BlockNode;
import com.dcruver.notegraph.graph.NoteGraph;
import com.dcruver.notegraph.graph.PageNode;
import com.dcruver.notegraph.graph.Relationship;
import com.dcruver.notegraph.graph.RelationshipType;
import com.dcruver.notegraph.graph.ResourceNode;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a graph into the node and relationship tables the bulk loader copies from.
 */
public final class GraphTables {

    private GraphTables() {
    }

    /**
     * One named table: ordered column names and rows keyed by column
     */
    @Value
    public static class Table {
        String name;
        List<String> columns;
        List<Map<String, Object>> rows;
    }

    public static List<Table> of(NoteGraph graph) {
        List<Table> tables = new ArrayList<>();
        tables.add(pages(graph));
        tables.add(blocks(graph));
        tables.add(resources(graph));
        for (RelationshipType type : RelationshipType.values()) {
            tables.add(relationships(graph, type));
        }
        return tables;
    }

    static Table pages(NoteGraph graph) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (PageNode page : graph.getPages()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", page.getName());
            row.put("is_placeholder", page.isPlaceholder());
            row.put("is_public", page.isPublic());
            rows.add(row);
        }
        return new Table("Page", List.of("name", "is_placeholder", "is_public"), rows);
    }

    static Table blocks(NoteGraph graph) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (BlockNode block : graph.getBlocks()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("uuid", block.getUuid().toString());
            row.put("content", block.getContent());
            row.put("is_heading", block.isHeading());
            row.put("directive", block.getDirective() == null ? "" : block.getDirective());
            row.put("position", block.getPosition());
            row.put("depth", block.getDepth());
            rows.add(row);
        }
        return new Table("Block", List.of("uuid", "content", "is_heading", "directive", "position", "depth"), rows);
    }

    static Table resources(NoteGraph graph) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ResourceNode resource : graph.getResources()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("path", resource.getPath());
            row.put("is_asset", resource.isAsset());
            rows.add(row);
        }
        return new Table("Resource", List.of("path", "is_asset"), rows);
    }

    static Table relationships(NoteGraph graph, RelationshipType type) {
        List<String> columns = new ArrayList<>(List.of("from", "to"));
        if (type.hasMixedSources()) {
            columns.add("from_kind");
        }
        columns.addAll(type.getPayloadColumns());

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Relationship rel : graph.relationshipsOf(type)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("from", rel.getSource().getId());
            row.put("to", rel.getTarget().getId());
            if (type.hasMixedSources()) {
                row.put("from_kind", rel.getSource().getKind().name());
            }
            for (String column : type.getPayloadColumns()) {
                row.put(column, payload(rel, column));
            }
            rows.add(row);
        }
        return new Table(type.getTableName(), List.copyOf(columns), rows);
    }

    private static Object payload(Relationship rel, String column) {
        return switch (column) {
            case "position" -> rel.getPosition();
            case "depth" -> rel.getDepth();
            case "label" -> rel.getLabel();
            case "value" -> rel.getValue();
            default -> throw new IllegalArgumentException("Unknown payload column: " + column);
        };
    }
}
