package com.dcruver.notegraph.app;

import com.dcruver.notegraph.config.ExtractorProperties;
import com.dcruver.notegraph.domain.ExtractionReport;
import com.dcruver.notegraph.domain.ExtractionRun;
import com.dcruver.notegraph.domain.GraphExtractionService;
import com.dcruver.notegraph.domain.SkippedNote;
import com.dcruver.notegraph.io.GraphExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Spring Shell commands for the note graph extractor.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GraphShellCommands {

    private final GraphExtractionService extractionService;
    private final GraphExporter exporter;
    private final ExtractorProperties properties;

    @ShellMethod(key = {"extract", "scan"}, value = "Extract the note graph and print the run report")
    public String extract(@ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String path) {
        ExtractionRun run = extractionService.extract(notesRoot(path));
        return formatReport(run.getReport());
    }

    @ShellMethod(key = "export", value = "Extract the note graph and write CSV tables, snapshot and report")
    public String export(
            @ShellOption(defaultValue = ShellOption.NULL, help = "Output directory") String output,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Notes directory") String path) {
        ExtractionRun run = extractionService.extract(notesRoot(path));
        Path outputDir = Path.of(output != null ? output : properties.getOutputDir());

        try {
            exporter.writeReport(run.getReport(), outputDir.resolve(GraphExporter.REPORT_FILE));
            if (!run.isSuccessful()) {
                return formatReport(run.getReport()) + "\nNothing exported; report written to " + outputDir + "\n";
            }

            List<Path> tables = exporter.writeTables(run.requireGraph(), outputDir);
            exporter.writeSnapshot(run.requireGraph(), outputDir.resolve(GraphExporter.SNAPSHOT_FILE));

            return formatReport(run.getReport())
                + String.format("\nExported %d tables to %s\n", tables.size(), outputDir);
        } catch (IOException e) {
            log.error("Export failed", e);
            return "Export failed: " + e.getMessage();
        }
    }

    String formatReport(ExtractionReport report) {
        StringBuilder result = new StringBuilder();
        result.append("Extraction of ").append(report.getNotesPath()).append("\n\n");

        result.append("Notes:\n");
        result.append(String.format("- Found: %d\n", report.getNotesFound()));
        result.append(String.format("- Succeeded: %d\n", report.getNotesSucceeded()));
        result.append(String.format("- Skipped: %d\n", report.getNotesSkipped()));
        for (SkippedNote skipped : report.getSkipped()) {
            result.append(String.format("    %s: %s\n", skipped.getPath(), skipped.getReason()));
        }
        result.append("\n");

        if (!report.isConsistent()) {
            result.append("Consistency check FAILED: ").append(report.getConsistencyError()).append("\n");
            return result.toString();
        }

        result.append("Consistency check passed.\n\n");
        result.append("Graph:\n");
        result.append(String.format("- Pages: %d (%d placeholders)\n", report.getPageCount(), report.getPlaceholderCount()));
        result.append(String.format("- Blocks: %d\n", report.getBlockCount()));
        result.append(String.format("- Resources: %d\n", report.getResourceCount()));
        result.append(String.format("- Relationships: %d\n", report.getRelationshipTotal()));
        for (Map.Entry<String, Integer> entry : report.getRelationshipCounts().entrySet()) {
            result.append(String.format("    %s: %d\n", entry.getKey(), entry.getValue()));
        }
        result.append(String.format("\nFinished in %d ms\n", report.getDuration().toMillis()));

        return result.toString();
    }

    private Path notesRoot(String path) {
        return Path.of(path != null ? path : properties.getNotesPath());
    }
}
