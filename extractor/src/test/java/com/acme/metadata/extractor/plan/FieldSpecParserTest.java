package com.acme.metadata.extractor.plan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldSpecParserTest {

    @Test
    void shouldSplitAndTrimSpecsAndSegments() {
        List<FieldSpec> specs = FieldSpecParser.parse(" creators.name , creators . affiliation.name,titles.title");

        assertEquals(3, specs.size());
        assertEquals(List.of("creators", "name"), specs.get(0).segments());
        assertEquals(List.of("creators", "affiliation", "name"), specs.get(1).segments());
        assertEquals("titles", specs.get(2).label());
        assertEquals("creators.affiliation.name", specs.get(1).dottedPath());
    }

    @Test
    void shouldKeepEmptySpecsForTheCompilerToReject() {
        List<FieldSpec> specs = FieldSpecParser.parse("doi,");

        assertEquals(2, specs.size());
        assertTrue(specs.get(1).segments().isEmpty());
        assertEquals("", specs.get(1).label());
    }

    @Test
    void shouldCollectDistinctLabelsInOrder() {
        List<FieldSpec> specs = FieldSpecParser.parse("titles.title,creators.name,titles.lang,creators.affiliation.name");

        assertEquals(List.of("titles", "creators"), List.copyOf(FieldSpecParser.labels(specs)));
    }
}
