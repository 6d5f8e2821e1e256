package com.acme.metadata.extractor.extract;

import com.acme.metadata.extractor.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Renders the JSON value at a terminal path into a single output cell.
 */
public final class ValueRenderer {
    private ValueRenderer() {
    }

    public static String render(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isValueNode()) {
            // numbers and booleans
            return node.asText();
        }
        return JsonCodec.writeCompact(node);
    }
}
