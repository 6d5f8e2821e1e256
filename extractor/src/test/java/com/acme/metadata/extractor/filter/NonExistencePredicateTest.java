package com.acme.metadata.extractor.filter;

import com.acme.metadata.extractor.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NonExistencePredicateTest {

    private final NonExistencePredicate noRelated = new NonExistencePredicate(List.of("relatedIdentifiers"));

    @Test
    void shouldHoldForAbsentOrEmptyValues() throws Exception {
        assertTrue(noRelated.test(JsonCodec.readTree("{}")));
        assertTrue(noRelated.test(JsonCodec.readTree("{\"relatedIdentifiers\":[]}")));
        assertTrue(noRelated.test(JsonCodec.readTree("{\"relatedIdentifiers\":null}")));
        assertTrue(noRelated.test(JsonCodec.readTree("{\"relatedIdentifiers\":{}}")));
    }

    @Test
    void shouldFailForPresentValues() throws Exception {
        assertFalse(noRelated.test(JsonCodec.readTree(
            "{\"relatedIdentifiers\":[{\"relationType\":\"Cites\",\"relatedIdentifier\":\"10.1/x\"}]}")));
        assertFalse(noRelated.test(JsonCodec.readTree("{\"relatedIdentifiers\":\"\"}")));
    }

    @Test
    void shouldNotExpandArraysAlongThePath() throws Exception {
        NonExistencePredicate nested = new NonExistencePredicate(List.of("creators", "affiliation"));

        assertTrue(nested.test(JsonCodec.readTree("{\"creators\":[{\"affiliation\":[{\"name\":\"X\"}]}]}")));
        assertFalse(nested.test(JsonCodec.readTree("{\"creators\":{\"affiliation\":\"X\"}}")));
    }
}
