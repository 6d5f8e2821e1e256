package com.acme.metadata.extractor.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Holds when {@code path} is absent or empty (null, {@code []}, {@code {}}).
 * Only plain object descent is followed; arrays along the way are not expanded.
 */
public final class NonExistencePredicate implements DocumentPredicate {
    private final List<String> path;

    public NonExistencePredicate(List<String> path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("exclusion path must not be empty");
        }
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }

    @Override
    public boolean test(JsonNode attributes) {
        JsonNode current = attributes;
        for (String segment : path) {
            current = current.get(segment);
            if (current == null) {
                return true;
            }
        }
        return isEmpty(current);
    }

    static boolean isEmpty(JsonNode node) {
        if (node.isNull()) {
            return true;
        }
        if (node.isArray() || node.isObject()) {
            return node.size() == 0;
        }
        return false;
    }

    @Override
    public RejectReason rejectReason() {
        return RejectReason.EXCLUDED_FIELD_PRESENT;
    }

    @Override
    public String toString() {
        return String.join(".", path);
    }
}
