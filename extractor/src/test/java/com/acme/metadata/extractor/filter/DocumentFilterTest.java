package com.acme.metadata.extractor.filter;

import com.acme.metadata.extractor.extract.RoutingKey;
import com.acme.metadata.extractor.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class DocumentFilterTest {

    private static final RoutingKey CERN = new RoutingKey("cern", "cern.zenodo");

    private final DocumentFilter filter = new DocumentFilter(FilterConfig.parse(
        "Dataset",
        List.of("relatedIdentifiers.relationType=IsSupplementTo"),
        List.of("fundingReferences"),
        false,
        "cern",
        null
    ));

    @Test
    void shouldAdmitWhenEveryPredicateHolds() throws Exception {
        JsonNode doc = JsonCodec.readTree("{\"types\":{\"resourceTypeGeneral\":\"Dataset\"},"
            + "\"relatedIdentifiers\":[{\"relationType\":\"IsSupplementTo\"}],\"fundingReferences\":[]}");

        assertInstanceOf(FilterDecision.Admit.class, filter.evaluate(doc, CERN));
    }

    @Test
    void shouldReportFirstFailingPredicate() throws Exception {
        JsonNode wrongType = JsonCodec.readTree("{\"types\":{\"resourceTypeGeneral\":\"Text\"},"
            + "\"fundingReferences\":[{\"funderName\":\"EC\"}]}");
        JsonNode funded = JsonCodec.readTree("{\"types\":{\"resourceTypeGeneral\":\"Dataset\"},"
            + "\"relatedIdentifiers\":[{\"relationType\":\"IsSupplementTo\"}],"
            + "\"fundingReferences\":[{\"funderName\":\"EC\"}]}");
        JsonNode unrelated = JsonCodec.readTree("{\"types\":{\"resourceTypeGeneral\":\"Dataset\"}}");

        assertEquals(RejectReason.CATEGORY_NOT_ALLOWED, reasonOf(filter.evaluate(wrongType, CERN)));
        assertEquals(RejectReason.EXCLUDED_FIELD_PRESENT, reasonOf(filter.evaluate(funded, CERN)));
        assertEquals(RejectReason.REQUIRED_VALUE_MISSING, reasonOf(filter.evaluate(unrelated, CERN)));
    }

    @Test
    void shouldRejectOtherProviders() throws Exception {
        JsonNode doc = JsonCodec.readTree("{\"types\":{\"resourceTypeGeneral\":\"Dataset\"},"
            + "\"relatedIdentifiers\":[{\"relationType\":\"IsSupplementTo\"}]}");

        FilterDecision decision = filter.evaluate(doc, new RoutingKey("bl", "bl.uk"));

        assertEquals(RejectReason.ROUTING_MISMATCH, reasonOf(decision));
    }

    private static RejectReason reasonOf(FilterDecision decision) {
        return assertInstanceOf(FilterDecision.Reject.class, decision).reason();
    }
}
