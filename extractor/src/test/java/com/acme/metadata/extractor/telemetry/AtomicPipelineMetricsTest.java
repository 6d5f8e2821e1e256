package com.acme.metadata.extractor.telemetry;

import com.acme.metadata.extractor.filter.RejectReason;
import com.acme.metadata.extractor.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtomicPipelineMetricsTest {

    @Test
    void shouldAggregateCountersFromManyThreads() throws Exception {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        int threads = 4;
        int perThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.execute(() -> {
                    for (int i = 0; i < perThread; i++) {
                        metrics.incLinesRead(1);
                        metrics.incDocumentsRejected(RejectReason.ROUTING_MISMATCH);
                    }
                    metrics.incFilesDone(true);
                    done.countDown();
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        metrics.incFilesDone(false);
        metrics.incDocumentsRejected(RejectReason.INCOMPLETE_FIELDS);

        AtomicPipelineMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(threads * perThread, snapshot.linesRead());
        assertEquals(threads, snapshot.filesSucceeded());
        assertEquals(1, snapshot.filesFailed());
        assertEquals(threads + 1, snapshot.filesDone());
        assertEquals(threads * perThread + 1, snapshot.documentsRejected());
        assertEquals(threads * perThread, snapshot.rejectedByReason().get(RejectReason.ROUTING_MISMATCH).longValue());
    }

    @Test
    void shouldRenderProgressAsJson() throws Exception {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        metrics.incFilesDone(true);
        metrics.incRecordsWritten(250);
        metrics.incDocumentsSkipped(4);
        metrics.setChannelDepth(3);
        metrics.setOpenOutputHandles(7);

        try (PeriodicProgressReporter reporter = new PeriodicProgressReporter(metrics, 10, 60)) {
            JsonNode json = JsonCodec.readTree(reporter.render());

            assertEquals("extraction_progress", json.get("type").asText());
            assertEquals(1, json.get("filesDone").asLong());
            assertEquals(10, json.get("filesTotal").asLong());
            assertEquals(250, json.get("recordsWritten").asLong());
            assertEquals(4, json.get("documentsSkipped").asLong());
            assertEquals(3, json.get("channelDepth").asInt());
            assertEquals(7, json.get("openOutputHandles").asInt());
        }
    }
}
