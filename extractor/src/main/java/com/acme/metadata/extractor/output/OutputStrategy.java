package com.acme.metadata.extractor.output;

import com.acme.metadata.extractor.extract.ExtractionRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Where extracted rows go. Chosen once at startup and driven only by the writer thread.
 *
 * <p>All methods throw {@link OutputException} on I/O failure.</p>
 */
public sealed interface OutputStrategy extends AutoCloseable permits SingleFileOutput, OrganizedOutput {

    void writeBatch(List<ExtractionRecord> batch);

    void flush();

    /** Flushes and closes every open destination. Idempotent. */
    @Override
    void close();

    int openHandleCount();

    static OutputStrategy create(Path output, boolean organize, int maxOpenFiles) {
        return organize ? new OrganizedOutput(output, maxOpenFiles) : new SingleFileOutput(output);
    }
}
