package com.acme.metadata.extractor.filter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Set;

/**
 * Admits documents whose category at a fixed path is one of the allowed values.
 * An absent or non-textual category is rejected.
 */
public final class CategoryAllowList implements DocumentPredicate {
    public static final List<String> RESOURCE_TYPE_GENERAL_PATH = List.of("types", "resourceTypeGeneral");

    private final List<String> path;
    private final Set<String> allowed;

    public CategoryAllowList(Set<String> allowed) {
        this(RESOURCE_TYPE_GENERAL_PATH, allowed);
    }

    public CategoryAllowList(List<String> path, Set<String> allowed) {
        this.path = List.copyOf(path);
        this.allowed = Set.copyOf(allowed);
    }

    @Override
    public boolean test(JsonNode attributes) {
        JsonNode current = attributes;
        for (String segment : path) {
            current = current.get(segment);
            if (current == null) {
                return false;
            }
        }
        return current.isTextual() && allowed.contains(current.textValue());
    }

    @Override
    public RejectReason rejectReason() {
        return RejectReason.CATEGORY_NOT_ALLOWED;
    }

    @Override
    public String toString() {
        return String.join(".", path) + " in " + allowed;
    }
}
