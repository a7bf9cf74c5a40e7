package com.dcruver.notegraph.domain;

import com.dcruver.notegraph.config.ExtractorProperties;
import com.dcruver.notegraph.graph.GraphAssembler;
import com.dcruver.notegraph.graph.GraphConsistencyException;
import com.dcruver.notegraph.graph.GraphValidator;
import com.dcruver.notegraph.graph.NoteGraph;
import com.dcruver.notegraph.identity.NameNormalizer;
import com.dcruver.notegraph.io.NoteFileReader;
import com.dcruver.notegraph.parse.FragmentExtractor;
import com.dcruver.notegraph.parse.LinkExtractor;
import com.dcruver.notegraph.parse.OutlineParser;
import com.dcruver.notegraph.parse.PropertyExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs over a small note collection on disk.
 */
class GraphExtractionServiceTest {

    private ExtractorProperties properties;
    private NoteCollectionScanner scanner;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ExtractorProperties();
        properties.setNotesPath(tempDir.toString());
        PropertyExtractor propertyExtractor = new PropertyExtractor(properties);
        FragmentExtractor fragmentExtractor = new FragmentExtractor(properties,
            new OutlineParser(properties, propertyExtractor), propertyExtractor, new LinkExtractor());
        scanner = new NoteCollectionScanner(properties, new NoteFileReader(properties), fragmentExtractor,
            new NameNormalizer(properties));

        write("projects/alpha.md", "- Status:: active\n\t- See [[projects/beta]]\n");
        write("pages/inbox.md", "- call back #todo\n- ![cat](./images/cat.png)\n");
        write("journals/2024_01_01.md", "- review #todo\n");
    }

    @Test
    void testSuccessfulRunReport() {
        ExtractionRun run = service(new GraphValidator()).extract();

        assertTrue(run.isSuccessful());
        ExtractionReport report = run.getReport();
        assertTrue(report.isConsistent());
        assertNull(report.getConsistencyError());
        assertEquals(3, report.getNotesFound());
        assertEquals(3, report.getNotesSucceeded());
        assertEquals(0, report.getNotesSkipped());
        assertEquals(2, report.getRelationshipCounts().get("LinksAsTag"));
        assertEquals(1, report.getRelationshipCounts().get("LinksToResource"));
        assertEquals(0, report.getRelationshipCounts().get("LinksToBlock"));
        assertEquals(1, report.getResourceCount());
        assertEquals(run.getGraph().getPages().size(), report.getPageCount());
        assertFalse(report.getFinishedAt().isBefore(report.getStartedAt()));
    }

    @Test
    void testGraphContents() {
        NoteGraph graph = service(new GraphValidator()).extract(tempDir).requireGraph();

        assertFalse(graph.page("projects/alpha").orElseThrow().isPlaceholder());
        assertFalse(graph.page("inbox").orElseThrow().isPlaceholder());
        assertFalse(graph.page("2024_01_01").orElseThrow().isPlaceholder());
        assertTrue(graph.page("todo").orElseThrow().isPlaceholder());
        assertTrue(graph.resource("images/cat.png").orElseThrow().isAsset());
    }

    @Test
    void testRepeatedRunsProduceSameGraph() {
        GraphExtractionService service = service(new GraphValidator());

        NoteGraph first = service.extract(tempDir).requireGraph();
        NoteGraph second = service.extract(tempDir).requireGraph();

        assertEquals(first, second);
    }

    @Test
    void testSkippedNotesAppearInReport() throws Exception {
        Files.write(tempDir.resolve("broken.md"), new byte[] {(byte) 0xFF, (byte) 0xFE, (byte) 0xC3});

        ExtractionReport report = service(new GraphValidator()).extract(tempDir).getReport();

        assertTrue(report.isConsistent());
        assertEquals(4, report.getNotesFound());
        assertEquals(3, report.getNotesSucceeded());
        assertEquals(List.of("broken.md"), report.getSkipped().stream().map(SkippedNote::getPath).toList());
    }

    @Test
    void testEmptyPageNameDoesNotAbortRun() throws Exception {
        write("pages/.md", "- see [[inbox]]\n");

        ExtractionRun run = service(new GraphValidator()).extract(tempDir);

        assertTrue(run.isSuccessful());
        assertEquals(4, run.getReport().getNotesFound());
        assertEquals(3, run.getReport().getNotesSucceeded());
        assertEquals(List.of("pages/.md"), run.getReport().getSkipped().stream().map(SkippedNote::getPath).toList());
        assertFalse(run.requireGraph().page("inbox").orElseThrow().isPlaceholder());
    }

    @Test
    void testConsistencyFailureWithholdsGraph() {
        GraphValidator failing = new GraphValidator() {
            @Override
            public void validate(NoteGraph graph) {
                throw new GraphConsistencyException(List.of("Links target missing: PAGE:ghost"));
            }
        };

        ExtractionRun run = service(failing).extract(tempDir);

        assertFalse(run.isSuccessful());
        assertFalse(run.getReport().isConsistent());
        assertTrue(run.getReport().getConsistencyError().contains("PAGE:ghost"));
        assertEquals(3, run.getReport().getNotesSucceeded());
        assertThrows(IllegalStateException.class, run::requireGraph);
    }

    private GraphExtractionService service(GraphValidator validator) {
        GraphAssembler assembler = new GraphAssembler(new NameNormalizer(properties), validator);
        return new GraphExtractionService(properties, scanner, assembler);
    }

    private void write(String relativePath, String text) throws Exception {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
    }
}
