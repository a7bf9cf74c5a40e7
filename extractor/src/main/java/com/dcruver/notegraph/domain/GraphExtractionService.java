package com.dcruver.notegraph.domain;

import com.dcruver.notegraph.config.ExtractorProperties;
import com.dcruver.notegraph.graph.GraphAssembler;
import com.dcruver.notegraph.graph.GraphConsistencyException;
import com.dcruver.notegraph.graph.NoteGraph;
import com.dcruver.notegraph.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a full extraction: parallel per-note phase, then sequential assembly and validation.
 * Each call is independent; no state survives between runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphExtractionService {

    private final ExtractorProperties properties;
    private final NoteCollectionScanner scanner;
    private final GraphAssembler assembler;

    /**
     * Extract the collection at the configured notes path
     */
    public ExtractionRun extract() {
        return extract(Path.of(properties.getNotesPath()));
    }

    public ExtractionRun extract(Path notesRoot) {
        Instant startedAt = Instant.now();
        log.info("Starting extraction of {}", notesRoot);

        ScanResult scan = scanner.scan(notesRoot);

        ExtractionReport.ExtractionReportBuilder report = ExtractionReport.builder()
            .notesPath(notesRoot.toAbsolutePath().normalize().toString())
            .notesFound(scan.getNotesFound())
            .notesSucceeded(scan.getFragments().size())
            .skipped(scan.getSkipped())
            .startedAt(startedAt);

        NoteGraph graph;
        try {
            graph = assembler.assemble(scan.getFragments());
        } catch (GraphConsistencyException e) {
            log.error("Graph failed consistency check: {}", e.getMessage());
            ExtractionReport failed = report
                .consistent(false)
                .consistencyError(e.getMessage())
                .relationshipCounts(Map.of())
                .finishedAt(Instant.now())
                .build();
            return new ExtractionRun(failed, null);
        }

        ExtractionReport done = report
            .consistent(true)
            .pageCount(graph.getPages().size())
            .placeholderCount((int) graph.placeholderCount())
            .blockCount(graph.getBlocks().size())
            .resourceCount(graph.getResources().size())
            .relationshipCounts(relationshipCounts(graph))
            .finishedAt(Instant.now())
            .build();

        log.info("Extraction finished in {} ms: {} of {} notes, {} skipped",
            done.getDuration().toMillis(), done.getNotesSucceeded(), done.getNotesFound(), done.getNotesSkipped());
        return new ExtractionRun(done, graph);
    }

    private static Map<String, Integer> relationshipCounts(NoteGraph graph) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<RelationshipType, Integer> entry : graph.countByType().entrySet()) {
            counts.put(entry.getKey().getTableName(), entry.getValue());
        }
        return counts;
    }
}
