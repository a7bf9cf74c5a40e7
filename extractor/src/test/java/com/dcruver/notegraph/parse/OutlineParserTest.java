package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outline parsing: tree shape, properties, directives, headings and code fences.
 */
class OutlineParserTest {

    private OutlineParser parser;

    @BeforeEach
    void setUp() {
        ExtractorProperties properties = new ExtractorProperties();
        parser = new OutlineParser(properties, new PropertyExtractor(properties));
    }

    @Test
    void testNestedOutlineShape() {
        String text = """
            - Root one
              - Child a
              - Child b
                - Grandchild
            - Root two
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertEquals(5, blocks.size());
        assertBlock(blocks.get(0), "Root one", null, 0, 0);
        assertBlock(blocks.get(1), "Child a", 0, 1, 0);
        assertBlock(blocks.get(2), "Child b", 0, 1, 1);
        assertBlock(blocks.get(3), "Grandchild", 2, 2, 0);
        assertBlock(blocks.get(4), "Root two", null, 0, 1);
        assertTrue(blocks.get(4).isRoot());
    }

    @Test
    void testTabsCountAsConfiguredWidth() {
        List<ParsedBlock> blocks = parser.parseAll("- Parent\n\t- Child\n\t\t- Grandchild\n");

        assertEquals(3, blocks.size());
        assertBlock(blocks.get(1), "Child", 0, 1, 0);
        assertBlock(blocks.get(2), "Grandchild", 1, 2, 0);
    }

    @Test
    void testUnevenIndentationFindsNearestParent() {
        String text = """
            - Root
                  - Deep child
               - Shallower sibling
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertBlock(blocks.get(1), "Deep child", 0, 1, 0);
        assertBlock(blocks.get(2), "Shallower sibling", 0, 1, 1);
    }

    @Test
    void testTextBeforeFirstBulletIsPreBlock() {
        String text = """
            Intro text
            - First
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertEquals(2, blocks.size());
        assertBlock(blocks.get(0), "Intro text", null, 0, 0);
        assertBlock(blocks.get(1), "First", null, 0, 1);
    }

    @Test
    void testContinuationLinesJoinTheBlock() {
        String text = """
            - First line
              second line

              third line
            - Next
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertEquals(2, blocks.size());
        assertEquals("First line\nsecond line\n\nthird line", blocks.get(0).getContent());
    }

    @Test
    void testPropertiesOnFirstLine() {
        String text = """
            - Status:: active
              owner:: bob
              Body text
            """;

        ParsedBlock block = parser.parseAll(text).get(0);

        assertEquals(2, block.getProperties().size());
        assertEquals("status", block.getProperties().get(0).getKey());
        assertEquals("bob", block.getProperties().get(1).getValue());
        assertEquals("Body text", block.getContent());
        assertFalse(block.isPropertyOnly());
    }

    @Test
    void testPropertiesAfterTitleLine() {
        String text = """
            - Title line
              type:: meeting
              notes about it
              late:: not a property
            """;

        ParsedBlock block = parser.parseAll(text).get(0);

        assertEquals(1, block.getProperties().size());
        assertEquals("type", block.getProperties().get(0).getKey());
        assertEquals("Title line\nnotes about it\nlate:: not a property", block.getContent());
    }

    @Test
    void testPropertyOnlyBlock() {
        String text = """
            - public:: true
              tags:: a, b
            - Body
            """;

        ParsedBlock block = parser.parseAll(text).get(0);

        assertTrue(block.isPropertyOnly());
        assertEquals("", block.getContent());
        assertEquals(2, block.getProperties().size());
    }

    @Test
    void testMarkerDirective() {
        ParsedBlock block = parser.parseAll("- TODO write tests\n").get(0);

        assertEquals("TODO", block.getDirective());
        assertEquals("write tests", block.getContent());
    }

    @Test
    void testMarkerMustBeWholeWord() {
        ParsedBlock block = parser.parseAll("- TODOS are piling up\n").get(0);

        assertNull(block.getDirective());
        assertEquals("TODOS are piling up", block.getContent());
    }

    @Test
    void testBeginEndDirective() {
        String text = """
            - #+BEGIN_QUOTE
              Quoted words
              #+END_QUOTE
            """;

        ParsedBlock block = parser.parseAll(text).get(0);

        assertEquals("QUOTE", block.getDirective());
        assertEquals("Quoted words", block.getContent());
    }

    @Test
    void testUnclosedBeginKeepsDirective() {
        String text = """
            - #+begin_note
              never closed
            """;

        ParsedBlock block = parser.parseAll(text).get(0);

        assertEquals("NOTE", block.getDirective());
        assertEquals("never closed", block.getContent());
    }

    @Test
    void testUnrecognizedDirectiveIsContent() {
        ParsedBlock block = parser.parseAll("- #+BEGIN_FOO\n  body\n  #+END_FOO\n").get(0);

        assertNull(block.getDirective());
        assertEquals("#+BEGIN_FOO\nbody\n#+END_FOO", block.getContent());
    }

    @Test
    void testBraceDirectiveKeepsArguments() {
        ParsedBlock block = parser.parseAll("- {{query (todo now)}}\n").get(0);

        assertEquals("QUERY", block.getDirective());
        assertEquals("(todo now)", block.getContent());
    }

    @Test
    void testHeadingFromMarkupOrProperty() {
        String text = """
            - ## Big title
            - plain text
              heading:: true
            - # Title with a trailing hash#
            - #tag only
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertTrue(blocks.get(0).isHeading());
        assertTrue(blocks.get(1).isHeading());
        assertTrue(blocks.get(2).isHeading());
        assertFalse(blocks.get(3).isHeading());
    }

    @Test
    void testCodeFenceHidesBulletsAndProperties() {
        String text = """
            - ```
              - not a child
              key:: v
              ```
            - Next
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertEquals(2, blocks.size());
        assertEquals("```\n- not a child\nkey:: v\n```", blocks.get(0).getContent());
        assertTrue(blocks.get(0).getProperties().isEmpty());
        assertBlock(blocks.get(1), "Next", null, 0, 1);
    }

    @Test
    void testUnclosedFenceEndsAtNextSiblingBullet() {
        String text = """
            - ```
              unterminated
            - Sibling
            """;

        List<ParsedBlock> blocks = parser.parseAll(text);

        assertEquals(2, blocks.size());
        assertEquals("Sibling", blocks.get(1).getContent());
    }

    @Test
    void testEmptyBullet() {
        List<ParsedBlock> blocks = parser.parseAll("-\n- After\n");

        assertEquals(2, blocks.size());
        assertEquals("", blocks.get(0).getContent());
    }

    @Test
    void testEmptyInput() {
        assertTrue(parser.parseAll("").isEmpty());
        assertTrue(parser.parseAll("\n\n   \n").isEmpty());
        assertTrue(parser.parseAll(null).isEmpty());
    }

    @Test
    void testEachIterationIsIndependent() {
        Iterable<ParsedBlock> blocks = parser.parse("- a\n  - b\n- c\n");

        Iterator<ParsedBlock> first = blocks.iterator();
        first.next();
        Iterator<ParsedBlock> second = blocks.iterator();

        assertEquals("a", second.next().getContent());
        assertEquals("b", first.next().getContent());
        assertEquals(parser.parseAll("- a\n  - b\n- c\n"), parser.parseAll("- a\n  - b\n- c\n"));
    }

    private static void assertBlock(ParsedBlock block, String content, Integer parent, int depth, int position) {
        assertEquals(content, block.getContent());
        assertEquals(parent, block.getParentOrdinal());
        assertEquals(depth, block.getDepth());
        assertEquals(position, block.getPosition());
    }
}
