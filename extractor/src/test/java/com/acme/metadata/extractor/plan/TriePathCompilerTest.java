package com.acme.metadata.extractor.plan;

import com.acme.metadata.extractor.schema.Schema;
import com.acme.metadata.extractor.schema.SchemaRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriePathCompilerTest {

    private final TriePathCompiler compiler = new TriePathCompiler();

    @Test
    void shouldInsertWildcardAfterEveryArrayPrefix() {
        TraversalPlan plan = compile("creators.affiliation.name");

        PlanNode creators = child(plan.root(), "creators");
        assertNotNull(creators.wildcard(), "creators is an array");
        assertTrue(creators.children().isEmpty());

        PlanNode affiliation = child(creators.wildcard(), "affiliation");
        assertNotNull(affiliation.wildcard(), "creators.affiliation is an array");

        PlanNode name = child(affiliation.wildcard(), "name");
        assertEquals("creators", name.terminalLabel());
        assertTrue(name.isLeaf());
    }

    @Test
    void shouldShareCommonPrefixesAcrossSpecs() {
        TraversalPlan plan = compile("creators.name,creators.affiliation.name,titles.title");

        assertEquals(2, plan.root().children().size());
        PlanNode creatorElement = child(plan.root(), "creators").wildcard();
        assertEquals(List.of("name", "affiliation"),
            creatorElement.children().stream().map(PlanNode.Child::segment).toList());
        assertEquals(List.of("creators", "titles"), List.copyOf(FieldSpecParser.labels(plan.specs())));
    }

    @Test
    void shouldNotInsertWildcardForNonArrayPaths() {
        TraversalPlan plan = compile("types.resourceTypeGeneral");

        PlanNode types = child(plan.root(), "types");
        assertNull(types.wildcard());
        assertEquals("types", child(types, "resourceTypeGeneral").terminalLabel());
    }

    @Test
    void shouldMarkArrayNodeTerminalOnItsWildcard() {
        TraversalPlan plan = compile("subjects");

        PlanNode subjects = child(plan.root(), "subjects");
        assertNull(subjects.terminalLabel());
        assertEquals("subjects", subjects.wildcard().terminalLabel());
    }

    @Test
    void shouldProduceStructurallyEqualPlansForSameInput() {
        String fields = "creators.name,creators.affiliation.name,titles.title,publisher,creators.nameIdentifiers.nameIdentifier";
        TraversalPlan first = compile(fields);
        TraversalPlan second = compile(fields);

        assertEquals(first, second);
        assertEquals(first.root(), second.root());
        assertEquals(first.nodeCount(), second.nodeCount());
    }

    @Test
    void shouldFailOnEmptyInputs() {
        CompileResult noSpecs = compiler.compile(List.of(), SchemaRegistry.datacite());
        assertEquals("EMPTY_FIELDS", assertInstanceOf(CompileResult.Failure.class, noSpecs).code());

        CompileResult emptySpec = compiler.compile(FieldSpecParser.parse("creators.name,,titles.title"), SchemaRegistry.datacite());
        CompileResult.Failure failure = assertInstanceOf(CompileResult.Failure.class, emptySpec);
        assertEquals("EMPTY_SPEC", failure.code());
        assertEquals(1, failure.position());

        CompileResult emptySegment = compiler.compile(FieldSpecParser.parse("creators..name"), SchemaRegistry.datacite());
        assertEquals("EMPTY_SEGMENT", assertInstanceOf(CompileResult.Failure.class, emptySegment).code());
    }

    @Test
    void shouldUseCustomSchema() {
        Schema schema = Schema.ofArrayPrefixes(List.of("items", "items.tags"));
        CompileResult result = compiler.compile(FieldSpecParser.parse("items.tags"), schema);
        TraversalPlan plan = assertInstanceOf(CompileResult.Success.class, result).plan();

        PlanNode tags = child(child(plan.root(), "items").wildcard(), "tags");
        assertEquals("items", tags.wildcard().terminalLabel());
    }

    private TraversalPlan compile(String fields) {
        CompileResult result = compiler.compile(FieldSpecParser.parse(fields), SchemaRegistry.datacite());
        return assertInstanceOf(CompileResult.Success.class, result).plan();
    }

    private static PlanNode child(PlanNode node, String segment) {
        for (PlanNode.Child c : node.children()) {
            if (c.segment().equals(segment)) {
                return c.node();
            }
        }
        throw new AssertionError("missing child " + segment);
    }
}
