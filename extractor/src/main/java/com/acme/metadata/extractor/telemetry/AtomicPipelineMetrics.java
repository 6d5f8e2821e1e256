package com.acme.metadata.extractor.telemetry;

import com.acme.metadata.extractor.filter.RejectReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicPipelineMetrics implements PipelineMetrics {
    private final LongAdder filesSucceeded = new LongAdder();
    private final LongAdder filesFailed = new LongAdder();
    private final LongAdder linesRead = new LongAdder();
    private final LongAdder malformedLines = new LongAdder();
    private final LongAdder documentsSkipped = new LongAdder();
    private final LongAdder documentsExtracted = new LongAdder();
    private final LongAdder recordsExtracted = new LongAdder();
    private final LongAdder batchesWritten = new LongAdder();
    private final LongAdder recordsWritten = new LongAdder();
    private final AtomicInteger channelDepth = new AtomicInteger();
    private final AtomicInteger openOutputHandles = new AtomicInteger();
    private final ConcurrentHashMap<RejectReason, LongAdder> rejectedByReason = new ConcurrentHashMap<>();

    @Override
    public void incFilesDone(boolean succeeded) {
        (succeeded ? filesSucceeded : filesFailed).increment();
    }

    @Override
    public void incLinesRead(long n) {
        linesRead.add(Math.max(0L, n));
    }

    @Override
    public void incMalformedLines(long n) {
        malformedLines.add(Math.max(0L, n));
    }

    @Override
    public void incDocumentsSkipped(long n) {
        documentsSkipped.add(Math.max(0L, n));
    }

    @Override
    public void incDocumentsRejected(RejectReason reason) {
        if (reason == null) return;
        rejectedByReason.computeIfAbsent(reason, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incDocumentsExtracted(long n) {
        documentsExtracted.add(Math.max(0L, n));
    }

    @Override
    public void incRecordsExtracted(long n) {
        recordsExtracted.add(Math.max(0L, n));
    }

    @Override
    public void incBatchesWritten(long n) {
        batchesWritten.add(Math.max(0L, n));
    }

    @Override
    public void incRecordsWritten(long n) {
        recordsWritten.add(Math.max(0L, n));
    }

    @Override
    public void setChannelDepth(int depth) {
        channelDepth.set(Math.max(0, depth));
    }

    @Override
    public void setOpenOutputHandles(int handles) {
        openOutputHandles.set(Math.max(0, handles));
    }

    public Snapshot snapshot() {
        Map<RejectReason, Long> rejected = new EnumMap<>(RejectReason.class);
        rejectedByReason.forEach((k, v) -> rejected.put(k, v.sum()));
        return new Snapshot(
            filesSucceeded.sum(),
            filesFailed.sum(),
            linesRead.sum(),
            malformedLines.sum(),
            documentsSkipped.sum(),
            documentsExtracted.sum(),
            recordsExtracted.sum(),
            batchesWritten.sum(),
            recordsWritten.sum(),
            channelDepth.get(),
            openOutputHandles.get(),
            Collections.unmodifiableMap(rejected)
        );
    }

    public record Snapshot(long filesSucceeded,
                           long filesFailed,
                           long linesRead,
                           long malformedLines,
                           long documentsSkipped,
                           long documentsExtracted,
                           long recordsExtracted,
                           long batchesWritten,
                           long recordsWritten,
                           int channelDepth,
                           int openOutputHandles,
                           Map<RejectReason, Long> rejectedByReason) {
        public long filesDone() {
            return filesSucceeded + filesFailed;
        }

        public long documentsRejected() {
            long total = 0;
            for (long v : rejectedByReason.values()) {
                total += v;
            }
            return total;
        }
    }
}
