package com.acme.metadata.extractor.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Document id and routing key read from fixed locations of a DataCite record:
 * {@code /id} (falling back to {@code /attributes/doi}), {@code /relationships/provider/data/id}
 * and {@code /relationships/client/data/id}.
 */
public record DocumentIdentity(String documentId, RoutingKey routingKey) {

    public static Optional<DocumentIdentity> of(JsonNode record) {
        String id = text(record, "/id");
        if (id == null) {
            id = text(record, "/attributes/doi");
        }
        String provider = text(record, "/relationships/provider/data/id");
        String client = text(record, "/relationships/client/data/id");
        if (id == null || provider == null || client == null) {
            return Optional.empty();
        }
        return Optional.of(new DocumentIdentity(id, new RoutingKey(provider, client)));
    }

    private static String text(JsonNode record, String pointer) {
        JsonNode node = record.at(pointer);
        return node.isTextual() ? node.asText() : null;
    }
}
