package com.acme.metadata.extractor.pipeline;

import com.acme.metadata.extractor.extract.DocumentIdentity;
import com.acme.metadata.extractor.extract.ExtractionRecord;
import com.acme.metadata.extractor.extract.TraversalEngine;
import com.acme.metadata.extractor.filter.CompletenessGate;
import com.acme.metadata.extractor.filter.DocumentFilter;
import com.acme.metadata.extractor.filter.FilterDecision;
import com.acme.metadata.extractor.filter.RejectReason;
import com.acme.metadata.extractor.queue.BoundedChannel;
import com.acme.metadata.extractor.queue.ChannelClosedException;
import com.acme.metadata.extractor.queue.SendResult;
import com.acme.metadata.extractor.telemetry.NoopPipelineMetrics;
import com.acme.metadata.extractor.telemetry.PipelineMetrics;
import com.acme.metadata.extractor.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

/**
 * Decodes one input file line by line, filters and extracts each document, and sends
 * full batches to the writer.
 *
 * <p>Thread-safe: all state lives on the stack of {@link #process(Path, BoundedChannel)}.</p>
 */
public final class JsonlFileProcessor {
    private static final Logger LOG = Logger.getLogger(JsonlFileProcessor.class.getName());
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    private final TraversalEngine engine;
    private final DocumentFilter filter;
    private final CompletenessGate completenessGate;
    private final int batchSize;
    private final PipelineMetrics metrics;

    /**
     * @param completenessGate {@code null} when complete label coverage is not required
     */
    public JsonlFileProcessor(TraversalEngine engine,
                              DocumentFilter filter,
                              CompletenessGate completenessGate,
                              int batchSize,
                              PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.completenessGate = completenessGate;
        this.batchSize = Math.max(1, batchSize);
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    /**
     * Processes a whole file. Open, decompression and UTF-8 decoding failures are caught here and
     * reported as {@link FileOutcome.Failed}; a line that is not valid JSON is skipped.
     *
     * @throws ChannelClosedException if the writer is gone; the caller must stop sending
     * @throws InterruptedException   if interrupted while blocked on a full channel
     */
    public FileOutcome process(Path file, BoundedChannel<RecordBatch> channel) throws InterruptedException {
        Counters counters = new Counters();
        List<ExtractionRecord> batch = new ArrayList<>(Math.min(batchSize, 1024));
        try (BufferedReader reader = open(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                counters.lines++;
                if (line.isBlank()) {
                    continue;
                }
                batch = processLine(file, line, counters, batch, channel);
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof ChannelClosedException closed) {
                throw closed;
            }
            metrics.incLinesRead(counters.lines);
            LOG.log(Level.WARNING, "Error processing " + file + ", skipping rest of file", e);
            return new FileOutcome.Failed(file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (!batch.isEmpty()) {
            send(file, batch, channel);
        }
        metrics.incLinesRead(counters.lines);
        return new FileOutcome.Completed(file, counters.lines, counters.malformed, counters.documents, counters.records);
    }

    private List<ExtractionRecord> processLine(Path file,
                                               String line,
                                               Counters counters,
                                               List<ExtractionRecord> batch,
                                               BoundedChannel<RecordBatch> channel) throws InterruptedException {
        JsonNode record;
        try {
            record = JsonCodec.readTree(line);
        } catch (JsonProcessingException e) {
            counters.malformed++;
            metrics.incMalformedLines(1L);
            LOG.fine(() -> "Skipping malformed line " + counters.lines + " in " + file + ": " + e.getOriginalMessage());
            return batch;
        }

        JsonNode attributes = record.get("attributes");
        if (attributes == null || !attributes.isObject()) {
            metrics.incDocumentsSkipped(1L);
            return batch;
        }
        Optional<DocumentIdentity> identity = DocumentIdentity.of(record);
        if (identity.isEmpty()) {
            metrics.incDocumentsSkipped(1L);
            return batch;
        }
        DocumentIdentity id = identity.get();

        FilterDecision decision = filter.evaluate(attributes, id.routingKey());
        if (decision instanceof FilterDecision.Reject reject) {
            metrics.incDocumentsRejected(reject.reason());
            return batch;
        }

        List<ExtractionRecord> extracted = engine.extract(attributes, id.documentId(), id.routingKey());
        if (completenessGate != null && !completenessGate.isComplete(extracted)) {
            metrics.incDocumentsRejected(RejectReason.INCOMPLETE_FIELDS);
            return batch;
        }
        if (extracted.isEmpty()) {
            return batch;
        }

        counters.documents++;
        counters.records += extracted.size();
        metrics.incDocumentsExtracted(1L);
        metrics.incRecordsExtracted(extracted.size());

        List<ExtractionRecord> current = batch;
        for (ExtractionRecord r : extracted) {
            current.add(r);
            if (current.size() >= batchSize) {
                send(file, current, channel);
                current = new ArrayList<>(Math.min(batchSize, 1024));
            }
        }
        return current;
    }

    private static void send(Path file, List<ExtractionRecord> records, BoundedChannel<RecordBatch> channel)
        throws InterruptedException {
        SendResult result = channel.send(new RecordBatch(file, records));
        if (result instanceof SendResult.Closed) {
            throw new ChannelClosedException("Writer disconnected, aborting processing for " + file);
        }
    }

    private static BufferedReader open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        try {
            if (InputFiles.isGzip(file)) {
                in = new GZIPInputStream(in, READ_BUFFER_BYTES);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        // invalid UTF-8 fails the file instead of decoding to U+FFFD
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        return new BufferedReader(new InputStreamReader(in, decoder), READ_BUFFER_BYTES);
    }

    private static final class Counters {
        long lines;
        long malformed;
        long documents;
        long records;
    }
}
