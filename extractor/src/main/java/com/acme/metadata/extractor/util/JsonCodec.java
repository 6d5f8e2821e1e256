package com.acme.metadata.extractor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON codec for input lines, compact value rendering and progress payloads.
 *
 * <p>{@link ObjectMapper} is thread-safe once configured, so one instance serves every worker.</p>
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /** Compact single-line JSON text of a subtree. */
    public static String writeCompact(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree that Jackson parsed is always serializable
            throw new IllegalStateException("Cannot serialize JSON subtree", e);
        }
    }
}
