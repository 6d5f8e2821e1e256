package com.acme.metadata.extractor.plan;

import java.util.List;

/**
 * A requested dotted field path. The label is the first segment and groups output rows.
 */
public record FieldSpec(List<String> segments) {
    public FieldSpec {
        segments = List.copyOf(segments);
    }

    public String label() {
        return segments.isEmpty() ? "" : segments.get(0);
    }

    public String dottedPath() {
        return String.join(".", segments);
    }
}
