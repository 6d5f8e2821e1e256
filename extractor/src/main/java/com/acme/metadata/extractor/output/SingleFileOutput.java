package com.acme.metadata.extractor.output;

import com.acme.metadata.extractor.extract.ExtractionRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Every row goes to one CSV file, truncated and given a header at startup.
 */
public final class SingleFileOutput implements OutputStrategy {
    private static final Logger LOG = Logger.getLogger(SingleFileOutput.class.getName());

    private final OutputHandle handle;

    public SingleFileOutput(Path path) {
        this.handle = OutputHandle.open(path, false, true);
        LOG.info(() -> "Writing all rows to " + path);
    }

    @Override
    public void writeBatch(List<ExtractionRecord> batch) {
        for (ExtractionRecord record : batch) {
            handle.write(record);
        }
    }

    @Override
    public void flush() {
        handle.flush();
    }

    @Override
    public void close() {
        if (handle.state() == HandleState.CLOSED) {
            return;
        }
        handle.close();
    }

    @Override
    public int openHandleCount() {
        return handle.state() == HandleState.CLOSED ? 0 : 1;
    }

    public long rowsWritten() {
        return handle.rowsWritten();
    }
}
