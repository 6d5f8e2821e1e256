package com.acme.metadata.extractor.extract;

import com.acme.metadata.extractor.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentIdentityTest {

    @Test
    void shouldReadIdAndRoutingKey() throws Exception {
        Optional<DocumentIdentity> identity = DocumentIdentity.of(JsonCodec.readTree(record("\"id\":\"10.5281/zenodo.1\",")));

        assertTrue(identity.isPresent());
        assertEquals("10.5281/zenodo.1", identity.get().documentId());
        assertEquals(new RoutingKey("cern", "cern.zenodo"), identity.get().routingKey());
    }

    @Test
    void shouldFallBackToAttributesDoi() throws Exception {
        Optional<DocumentIdentity> identity = DocumentIdentity.of(JsonCodec.readTree(record("")));

        assertEquals("10.82433/b09z-4k37", identity.orElseThrow().documentId());
    }

    @Test
    void shouldBeAbsentWithoutProvider() throws Exception {
        Optional<DocumentIdentity> identity = DocumentIdentity.of(JsonCodec.readTree(
            "{\"id\":\"x\",\"relationships\":{\"client\":{\"data\":{\"id\":\"c\"}}}}"));

        assertTrue(identity.isEmpty());
    }

    private static String record(String idField) {
        return "{" + idField
            + "\"attributes\":{\"doi\":\"10.82433/b09z-4k37\"},"
            + "\"relationships\":{\"provider\":{\"data\":{\"id\":\"cern\"}},"
            + "\"client\":{\"data\":{\"id\":\"cern.zenodo\"}}}}";
    }
}
