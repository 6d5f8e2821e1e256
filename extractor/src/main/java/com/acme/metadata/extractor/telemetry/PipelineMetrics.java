package com.acme.metadata.extractor.telemetry;

import com.acme.metadata.extractor.filter.RejectReason;

public interface PipelineMetrics {
    void incFilesDone(boolean succeeded);
    void incLinesRead(long n);
    void incMalformedLines(long n);
    void incDocumentsSkipped(long n);
    void incDocumentsRejected(RejectReason reason);
    void incDocumentsExtracted(long n);
    void incRecordsExtracted(long n);
    void incBatchesWritten(long n);
    void incRecordsWritten(long n);
    void setChannelDepth(int depth);
    void setOpenOutputHandles(int handles);
}
