package com.acme.metadata.extractor.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Holds when {@code literal} appears at {@code path} on any expansion branch.
 *
 * <p>Intermediate segments fan out breadth-first, expanding arrays into their elements.
 * At the final segment the value matches if it is the literal string or an array containing it,
 * e.g. {@code relatedIdentifiers.relationType=IsSupplementTo}.</p>
 */
public final class RequiredValuePredicate implements DocumentPredicate {
    private final List<String> path;
    private final String literal;

    public RequiredValuePredicate(List<String> path, String literal) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("required-value path must not be empty");
        }
        this.path = List.copyOf(path);
        this.literal = Objects.requireNonNull(literal, "literal");
    }

    public List<String> path() {
        return path;
    }

    public String literal() {
        return literal;
    }

    @Override
    public boolean test(JsonNode attributes) {
        List<JsonNode> current = List.of(attributes);
        int last = path.size() - 1;
        for (int i = 0; i < last; i++) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                JsonNode value = node.get(path.get(i));
                if (value == null) {
                    continue;
                }
                if (value.isArray()) {
                    value.forEach(next::add);
                } else {
                    next.add(value);
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }

        String finalSegment = path.get(last);
        for (JsonNode node : current) {
            JsonNode value = node.get(finalSegment);
            if (value == null) {
                continue;
            }
            if (value.isArray()) {
                for (JsonNode element : value) {
                    if (element.isTextual() && literal.equals(element.textValue())) {
                        return true;
                    }
                }
            } else if (value.isTextual() && literal.equals(value.textValue())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public RejectReason rejectReason() {
        return RejectReason.REQUIRED_VALUE_MISSING;
    }

    @Override
    public String toString() {
        return String.join(".", path) + "=" + literal;
    }
}
