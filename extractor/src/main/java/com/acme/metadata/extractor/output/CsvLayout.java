package com.acme.metadata.extractor.output;

import com.acme.metadata.extractor.extract.ExtractionRecord;

/**
 * Column layout shared by every CSV destination.
 */
public final class CsvLayout {
    private static final String[] HEADER = {"doi", "provider_id", "client_id", "field_name", "subfield_path", "value"};

    private CsvLayout() {
    }

    public static String[] header() {
        return HEADER.clone();
    }

    public static String[] row(ExtractionRecord record) {
        return new String[] {
            record.documentId(),
            record.routingKey().providerId(),
            record.routingKey().clientId(),
            record.fieldLabel(),
            record.concretePath(),
            record.value()
        };
    }
}
