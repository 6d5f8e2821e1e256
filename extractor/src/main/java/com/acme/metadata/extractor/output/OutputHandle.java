package com.acme.metadata.extractor.output;

import com.acme.metadata.extractor.extract.ExtractionRecord;
import com.opencsv.CSVWriter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * One open CSV destination. Not thread-safe; owned by the writer thread.
 */
public final class OutputHandle implements AutoCloseable {
    private final Path path;
    private final CSVWriter writer;
    private HandleState state;
    private long rowsWritten;

    private OutputHandle(Path path, CSVWriter writer) {
        this.path = path;
        this.writer = writer;
        this.state = HandleState.OPEN;
    }

    /**
     * Opens {@code path}, truncating it or appending to it, and writes the header when asked.
     */
    public static OutputHandle open(Path path, boolean append, boolean writeHeader) {
        Objects.requireNonNull(path, "path");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
            BufferedWriter out = new BufferedWriter(new OutputStreamWriter(
                Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode),
                StandardCharsets.UTF_8));
            OutputHandle handle = new OutputHandle(path, new CSVWriter(out));
            if (writeHeader) {
                handle.writer.writeNext(CsvLayout.header());
                handle.flush();
            }
            return handle;
        } catch (IOException e) {
            throw new OutputException(path, "Failed to open output", e);
        }
    }

    public Path path() {
        return path;
    }

    public HandleState state() {
        return state;
    }

    public long rowsWritten() {
        return rowsWritten;
    }

    public void write(ExtractionRecord record) {
        ensureOpen();
        writer.writeNext(CsvLayout.row(record));
        rowsWritten++;
        state = HandleState.OPEN;
    }

    public void flush() {
        ensureOpen();
        try {
            writer.flush();
        } catch (IOException e) {
            throw new OutputException(path, "Failed to flush output", e);
        }
        // CSVWriter records write errors instead of throwing them
        if (writer.checkError()) {
            throw new OutputException(path, "Failed to write output", null);
        }
        state = HandleState.FLUSHED;
    }

    @Override
    public void close() {
        if (state == HandleState.CLOSED) {
            return;
        }
        boolean failed = writer.checkError();
        state = HandleState.CLOSED;
        try {
            writer.close();
        } catch (IOException e) {
            throw new OutputException(path, "Failed to close output", e);
        }
        if (failed) {
            throw new OutputException(path, "Failed to write output", null);
        }
    }

    private void ensureOpen() {
        if (state == HandleState.CLOSED) {
            throw new IllegalStateException("output handle already closed: " + path);
        }
    }
}
