package com.acme.metadata.extractor.extract;

/**
 * One extracted value.
 *
 * @param concretePath path actually walked, array steps resolved, e.g. {@code creators[2].affiliation[0].name}
 */
public record ExtractionRecord(
    String documentId,
    RoutingKey routingKey,
    String fieldLabel,
    String concretePath,
    String value
) {}
