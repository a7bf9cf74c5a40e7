package com.dcruver.notegraph.parse;

import com.dcruver.notegraph.config.ExtractorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PropertyExtractorTest {

    private PropertyExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PropertyExtractor(new ExtractorProperties());
    }

    @Test
    void testParsesKeyAndValue() {
        Optional<Property> prop = extractor.parseLine("Status:: active");

        assertTrue(prop.isPresent());
        assertEquals("status", prop.get().getKey());
        assertEquals("Status", prop.get().getRawKey());
        assertEquals("active", prop.get().getValue());
    }

    @Test
    void testEmptyValueAndIndentation() {
        Optional<Property> prop = extractor.parseLine("    reviewed::");

        assertTrue(prop.isPresent());
        assertEquals("reviewed", prop.get().getKey());
        assertEquals("", prop.get().getValue());
    }

    @Test
    void testRejectsNonPropertyLines() {
        assertFalse(extractor.isPropertyLine("just some text"));
        assertFalse(extractor.isPropertyLine("key::value"), "Value must be separated by whitespace");
        assertFalse(extractor.isPropertyLine("see http://example.com"));
        assertFalse(extractor.isPropertyLine(":: orphan value"));
        assertFalse(extractor.isPropertyLine(null));
    }

    @Test
    void testSplitValuesKeepsCommasInsideLinks() {
        List<String> values = extractor.splitValues("alpha, [[b, c]], #todo, #[[My Tag]]");

        assertEquals(List.of("alpha", "b, c", "todo", "My Tag"), values);
    }

    @Test
    void testSplitValuesSkipsEmptyItems() {
        assertEquals(List.of("a", "b"), extractor.splitValues(" a ,, b, "));
        assertTrue(extractor.splitValues("  ").isEmpty());
    }

    @Test
    void testTagsComeOnlyFromTagsKey() {
        List<Property> props = List.of(
            new Property("tags", "Tags", "one, two"),
            new Property("type", "type", "three"));

        assertEquals(List.of("one", "two"), extractor.tagsOf(props));
    }

    @Test
    void testPublicAndHeadingFlags() {
        List<Property> props = List.of(
            new Property("public", "public", "Yes"),
            new Property("heading", "heading", "false"));

        assertTrue(extractor.isPublic(props));
        assertFalse(extractor.isHeading(props));
        assertFalse(extractor.isPublic(List.of()));
    }

    @Test
    void testValueOfReturnsFirstMatch() {
        List<Property> props = List.of(
            new Property("id", "id", "first"),
            new Property("id", "ID", "second"));

        assertEquals(Optional.of("first"), extractor.valueOf(props, "id"));
        assertEquals(Optional.empty(), extractor.valueOf(props, "missing"));
    }
}
