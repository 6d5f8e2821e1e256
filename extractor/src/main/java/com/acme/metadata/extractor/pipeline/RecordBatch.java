package com.acme.metadata.extractor.pipeline;

import com.acme.metadata.extractor.extract.ExtractionRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Unit moved from a worker to the writer. The worker hands over its list and starts a new one,
 * so nothing is shared after the send.
 */
public final class RecordBatch {
    private final Path source;
    private final List<ExtractionRecord> records;

    public RecordBatch(Path source, List<ExtractionRecord> records) {
        this.source = source;
        this.records = Objects.requireNonNull(records, "records");
    }

    public Path source() {
        return source;
    }

    public List<ExtractionRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }
}
