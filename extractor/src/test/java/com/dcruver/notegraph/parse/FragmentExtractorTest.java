package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FragmentExtractorTest {

    private static final UUID EXPLICIT = UUID.fromString("6500a1b2-0000-4000-8000-000000000001");

    private FragmentExtractor extractor;

    @BeforeEach
    void setUp() {
        ExtractorProperties properties = new ExtractorProperties();
        PropertyExtractor propertyExtractor = new PropertyExtractor(properties);
        extractor = new FragmentExtractor(properties, new OutlineParser(properties, propertyExtractor),
            propertyExtractor, new LinkExtractor());
    }

    @Test
    void testLeadingPropertyBlockBecomesPageProperties() {
        String text = "- Status:: active\n\t- See [[projects/beta]]\n";

        NoteFragment fragment = extractor.extract("projects/alpha.md", "projects/alpha", text);

        assertEquals("projects/alpha", fragment.getPageName());
        assertEquals(1, fragment.getPageProperties().size());
        assertEquals("status", fragment.getPageProperties().get(0).getKey());
        assertEquals("active", fragment.getPageProperties().get(0).getValue());

        assertEquals(2, fragment.getBlocks().size());
        BlockFragment section = fragment.getBlocks().get(0);
        assertEquals("", section.getContent());
        assertTrue(section.getProperties().isEmpty(), "Page properties are not repeated on the block");

        BlockFragment child = fragment.getBlocks().get(1);
        assertEquals(Integer.valueOf(0), child.getParentOrdinal());
        assertEquals(1, child.getDepth());
        assertEquals(List.of(new PageReference("projects/beta")), child.getReferences());
    }

    @Test
    void testPageTagsAndVisibility() {
        String text = """
            - tags:: alpha, [[Beta Gamma]]
              public:: yes
            - body
            """;

        NoteFragment fragment = extractor.extract("n.md", "n", text);

        assertEquals(List.of("alpha", "Beta Gamma"), fragment.getPageTags());
        assertTrue(fragment.isPagePublic());
        assertTrue(fragment.getBlocks().get(1).getTags().isEmpty());
    }

    @Test
    void testPropertiesOnLaterBlockStayOnBlock() {
        String text = """
            - intro
            - type:: idea
              tags:: later
            """;

        NoteFragment fragment = extractor.extract("n.md", "n", text);

        assertTrue(fragment.getPageProperties().isEmpty());
        assertFalse(fragment.isPagePublic());
        BlockFragment second = fragment.getBlocks().get(1);
        assertEquals(2, second.getProperties().size());
        assertEquals(List.of("later"), second.getTags());
    }

    @Test
    void testLinksInsidePropertyValuesAreReferences() {
        String text = """
            - related:: [[Roadmap]]
            - meeting
              attendee:: [[Ann]], #guest
              tags:: [[Later]]
            """;

        NoteFragment fragment = extractor.extract("n.md", "n", text);

        assertEquals(List.of(new PageReference("Roadmap")), fragment.getBlocks().get(0).getReferences(),
            "Page properties keep their links on the section block");
        assertEquals(List.of(new PageReference("Ann"), new TagReference("guest")),
            fragment.getBlocks().get(1).getReferences());
        assertEquals(List.of("Later"), fragment.getBlocks().get(1).getTags());
    }

    @Test
    void testExplicitIdIsConsumedAsIdentity() {
        String text = "- Important\n  id:: " + EXPLICIT + "\n";

        BlockFragment block = extractor.extract("n.md", "n", text).getBlocks().get(0);

        assertEquals(EXPLICIT, block.getUuid());
        assertTrue(block.isExplicitId());
        assertTrue(block.getProperties().isEmpty());
        assertEquals("Important", block.getContent());
    }

    @Test
    void testMalformedIdFallsBackToGeneratedId() {
        BlockFragment block = extractor.extract("n.md", "n", "- Text\n  id:: not-a-uuid\n").getBlocks().get(0);

        assertFalse(block.isExplicitId());
        assertEquals(FragmentExtractor.generatedId("n.md", 0), block.getUuid());
    }

    @Test
    void testGeneratedIdsAreStable() {
        String text = "- one\n- two\n  - three\n";

        NoteFragment first = extractor.extract("notes/x.md", "x", text);
        NoteFragment second = extractor.extract("notes/x.md", "x", text);

        assertEquals(first, second);
        assertNotEquals(first.getBlocks().get(0).getUuid(), first.getBlocks().get(1).getUuid());
        assertNotEquals(FragmentExtractor.generatedId("a.md", 0), FragmentExtractor.generatedId("b.md", 0));
    }

    @Test
    void testBlockCarriesDirectiveHeadingAndReferences() {
        String text = "- ## TODO ship [[Release]] #urgent\n";

        BlockFragment block = extractor.extract("n.md", "n", text).getBlocks().get(0);

        assertTrue(block.isHeading());
        assertNull(block.getDirective(), "Marker words only count at the start of the content");
        assertEquals(List.of(new PageReference("Release"), new TagReference("urgent")), block.getReferences());
    }
}
