package com.acme.metadata.extractor.telemetry;

import com.acme.metadata.extractor.filter.RejectReason;

public final class NoopPipelineMetrics implements PipelineMetrics {
    public static final NoopPipelineMetrics INSTANCE = new NoopPipelineMetrics();

    private NoopPipelineMetrics() {
    }

    @Override
    public void incFilesDone(boolean succeeded) {
    }

    @Override
    public void incLinesRead(long n) {
    }

    @Override
    public void incMalformedLines(long n) {
    }

    @Override
    public void incDocumentsSkipped(long n) {
    }

    @Override
    public void incDocumentsRejected(RejectReason reason) {
    }

    @Override
    public void incDocumentsExtracted(long n) {
    }

    @Override
    public void incRecordsExtracted(long n) {
    }

    @Override
    public void incBatchesWritten(long n) {
    }

    @Override
    public void incRecordsWritten(long n) {
    }

    @Override
    public void setChannelDepth(int depth) {
    }

    @Override
    public void setOpenOutputHandles(int handles) {
    }
}
