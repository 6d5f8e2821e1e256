package com.acme.metadata.extractor.schema;

import java.util.Collection;
import java.util.Set;

/**
 * Immutable set of dotted path prefixes that denote repeated (array) structures.
 */
public final class Schema {
    private final Set<String> arrayPrefixes;

    private Schema(Set<String> arrayPrefixes) {
        this.arrayPrefixes = arrayPrefixes;
    }

    public static Schema ofArrayPrefixes(Collection<String> arrayPrefixes) {
        return new Schema(Set.copyOf(arrayPrefixes));
    }

    public static Schema empty() {
        return new Schema(Set.of());
    }

    public boolean isArray(String dottedPath) {
        return arrayPrefixes.contains(dottedPath);
    }
}
