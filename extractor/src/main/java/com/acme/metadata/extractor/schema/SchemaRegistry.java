package com.acme.metadata.extractor.schema;

import java.util.List;

/**
 * Known array-valued prefixes of the DataCite metadata attributes object.
 */
public final class SchemaRegistry {
    private static final List<String> DATACITE_ARRAY_FIELDS = List.of(
        "identifiers", "alternateIdentifiers", "creators",
        "creators.affiliation", "creators.nameIdentifiers",
        "titles", "subjects", "contributors",
        "contributors.affiliation", "contributors.nameIdentifiers",
        "dates", "relatedIdentifiers", "relatedItems",
        "relatedItems.titles", "relatedItems.creators",
        "relatedItems.contributors", "sizes", "formats",
        "rightsList", "descriptions", "geoLocations",
        "geoLocations.geoLocationPolygon", "fundingReferences"
    );

    private static final Schema DATACITE = Schema.ofArrayPrefixes(DATACITE_ARRAY_FIELDS);

    private SchemaRegistry() {
    }

    public static Schema datacite() {
        return DATACITE;
    }
}
