package com.dcruver.notegraph.io;

import com.dcruver.notegraph.domain.ExtractionReport;
import com.dcruver.notegraph.graph.NoteGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a finished graph for the bulk loader: one CSV per node and relationship table,
 * plus a JSON snapshot of the same tables and a JSON run report.
 */
@Component
@Slf4j
public class GraphExporter {

    public static final String SNAPSHOT_FILE = "graph.json";
    public static final String REPORT_FILE = "report.json";

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Write every table as {@code <Table>.csv} with a header row
     *
     * @return the files written, in table order
     */
    public List<Path> writeTables(NoteGraph graph, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        List<GraphTables.Table> tables = GraphTables.of(graph);
        List<Path> written = new ArrayList<>();
        for (GraphTables.Table table : tables) {
            Path file = outputDir.resolve(table.getName() + ".csv");
            writeCsv(table, file);
            written.add(file);
            log.info("Wrote {} rows to {}", table.getRows().size(), file);
        }
        return written;
    }

    /**
     * Write all tables into a single pretty-printed JSON document keyed by table name
     */
    public Path writeSnapshot(NoteGraph graph, Path file) throws IOException {
        createParent(file);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), tablesByName(graph));
        log.info("Wrote graph snapshot to {}", file);
        return file;
    }

    public Path writeReport(ExtractionReport report, Path file) throws IOException {
        createParent(file);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        log.info("Wrote run report to {}", file);
        return file;
    }

    public String toJson(NoteGraph graph) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tablesByName(graph));
    }

    private Map<String, List<Map<String, Object>>> tablesByName(NoteGraph graph) {
        Map<String, List<Map<String, Object>>> snapshot = new LinkedHashMap<>();
        for (GraphTables.Table table : GraphTables.of(graph)) {
            snapshot.put(table.getName(), table.getRows());
        }
        return snapshot;
    }

    private void writeCsv(GraphTables.Table table, Path file) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : table.getColumns()) {
            schema.addColumn(column);
        }

        // Header written as a row of its own so empty tables still carry one
        try (SequenceWriter writer = csvMapper.writer(schema.build().withoutHeader()).writeValues(file.toFile())) {
            writer.write(table.getColumns());
            for (Map<String, Object> row : table.getRows()) {
                writer.write(row);
            }
        }
    }

    private void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
