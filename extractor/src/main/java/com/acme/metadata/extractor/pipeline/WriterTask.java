package com.acme.metadata.extractor.pipeline;

import com.acme.metadata.extractor.output.OutputStrategy;
import com.acme.metadata.extractor.queue.BoundedChannel;
import com.acme.metadata.extractor.telemetry.NoopPipelineMetrics;
import com.acme.metadata.extractor.telemetry.PipelineMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer of the batch channel and sole owner of the output strategy.
 *
 * <p>Runs until the channel is closed and drained, flushing every {@code flushEveryBatches}
 * batches and once more at the end, then closes every output. Any output failure is fatal:
 * the channel is disconnected so producers stop, the remaining outputs are closed best-effort,
 * and the failure is kept for {@link #failure()}.</p>
 */
public final class WriterTask implements Runnable {
    private static final Logger LOG = Logger.getLogger(WriterTask.class.getName());

    private final BoundedChannel<RecordBatch> channel;
    private final OutputStrategy output;
    private final int flushEveryBatches;
    private final PipelineMetrics metrics;

    private volatile long batchesWritten;
    private volatile long recordsWritten;
    private volatile Throwable failure;

    public WriterTask(BoundedChannel<RecordBatch> channel,
                      OutputStrategy output,
                      int flushEveryBatches,
                      PipelineMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.output = Objects.requireNonNull(output, "output");
        this.flushEveryBatches = Math.max(1, flushEveryBatches);
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    @Override
    public void run() {
        long batches = 0;
        long records = 0;
        boolean drained = false;
        try {
            RecordBatch batch;
            while ((batch = channel.receive()) != null) {
                output.writeBatch(batch.records());
                batches++;
                records += batch.size();
                metrics.incBatchesWritten(1L);
                metrics.incRecordsWritten(batch.size());
                metrics.setChannelDepth(channel.sizeApprox());
                metrics.setOpenOutputHandles(output.openHandleCount());
                if (batches % flushEveryBatches == 0) {
                    output.flush();
                }
            }
            output.flush();
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
        } catch (RuntimeException e) {
            fail(e);
        } finally {
            batchesWritten = batches;
            recordsWritten = records;
            if (!drained) {
                // also reached when an Error escapes the loop; producers must not block on a dead writer
                channel.disconnect();
                if (failure == null) {
                    failure = new IllegalStateException("writer stopped before the channel was drained");
                }
            }
            closeOutput();
            metrics.setOpenOutputHandles(0);
        }
    }

    private void fail(Throwable t) {
        LOG.log(Level.SEVERE, "Writer failed, disconnecting producers", t);
        failure = t;
        channel.disconnect();
    }

    private void closeOutput() {
        try {
            output.close();
        } catch (RuntimeException e) {
            if (failure == null) {
                LOG.log(Level.SEVERE, "Error closing outputs", e);
                failure = e;
                channel.disconnect();
            } else {
                failure.addSuppressed(e);
            }
        }
    }

    public long batchesWritten() {
        return batchesWritten;
    }

    public long recordsWritten() {
        return recordsWritten;
    }

    /** Fatal writer error, or {@code null}. Valid after the writer thread has been joined. */
    public Throwable failure() {
        return failure;
    }
}
