package com.dcruver.notegraph.domain;

import com.dcruver.notegraph.graph.NoteGraph;
import lombok.Value;

/**
 * Result of one run: always a report, and a graph only when the run passed validation.
 */
@Value
public class ExtractionRun {
    ExtractionReport report;
    NoteGraph graph;  // null when consistency failed

    public boolean isSuccessful() {
        return graph != null;
    }

    /**
     * Graph of a successful run
     *
     * @throws IllegalStateException if the run failed its consistency check
     */
    public NoteGraph requireGraph() {
        if (graph == null) {
            throw new IllegalStateException("Extraction failed, no graph to export: " + report.getConsistencyError());
        }
        return graph;
    }
}
