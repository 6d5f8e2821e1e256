package com.acme.metadata.extractor.telemetry;

import com.acme.metadata.extractor.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs a one-line JSON progress snapshot at a fixed interval while a run is in flight.
 */
public final class PeriodicProgressReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicProgressReporter.class.getName());

    private final AtomicPipelineMetrics metrics;
    private final long totalFiles;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicProgressReporter(AtomicPipelineMetrics metrics, long totalFiles, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.totalFiles = Math.max(0L, totalFiles);
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "extractor-progress-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "extraction_progress");
        payload.put("filesDone", s.filesDone());
        payload.put("filesTotal", totalFiles);
        payload.put("filesFailed", s.filesFailed());
        payload.put("linesRead", s.linesRead());
        payload.put("malformedLines", s.malformedLines());
        payload.put("documentsSkipped", s.documentsSkipped());
        payload.put("documentsExtracted", s.documentsExtracted());
        payload.put("documentsRejected", s.documentsRejected());
        payload.put("recordsWritten", s.recordsWritten());
        payload.put("batchesWritten", s.batchesWritten());
        payload.put("channelDepth", s.channelDepth());
        payload.put("openOutputHandles", s.openOutputHandles());
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Progress reporter failure", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
