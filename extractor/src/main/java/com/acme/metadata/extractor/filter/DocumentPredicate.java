package com.acme.metadata.extractor.filter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Admission check run against a document's attributes object before extraction.
 *
 * <p>Implementations are immutable and shared by all workers.
 */
public interface DocumentPredicate {
    /**
     * @param attributes the document's {@code attributes} object, never {@code null}
     * @return {@code true} if the document may be extracted
     */
    boolean test(JsonNode attributes);

    /** Reason reported when {@link #test(JsonNode)} rejects. */
    RejectReason rejectReason();
}
