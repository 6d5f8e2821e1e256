package com.acme.metadata.extractor.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the comma-separated field list given on the command line,
 * e.g. {@code "creators.name, creators.affiliation.name,titles.title"}.
 *
 * <p>Parsing is lenient: empty specs and empty segments are kept so that the compiler
 * can reject them with a position.</p>
 */
public final class FieldSpecParser {
    private FieldSpecParser() {
    }

    public static List<FieldSpec> parse(String fieldList) {
        if (fieldList == null) {
            return List.of();
        }
        List<FieldSpec> out = new ArrayList<>();
        for (String rawSpec : fieldList.split(",", -1)) {
            out.add(parsePath(rawSpec));
        }
        return out;
    }

    public static FieldSpec parsePath(String dottedPath) {
        String trimmed = dottedPath.trim();
        if (trimmed.isEmpty()) {
            return new FieldSpec(List.of());
        }
        List<String> segments = new ArrayList<>();
        for (String part : trimmed.split("\\.", -1)) {
            segments.add(part.trim());
        }
        return new FieldSpec(segments);
    }

    /** Distinct labels in first-seen order. */
    public static Set<String> labels(List<FieldSpec> specs) {
        Set<String> labels = new LinkedHashSet<>();
        for (FieldSpec spec : specs) {
            labels.add(spec.label());
        }
        return labels;
    }
}
