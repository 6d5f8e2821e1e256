package com.acme.metadata.extractor.pipeline;

import com.acme.metadata.extractor.util.ExtractorDefaults;

/**
 * Resolved tuning for one run.
 *
 * @param workers            worker threads, already resolved from 0 ("auto")
 * @param batchSize          records per batch sent to the writer
 * @param channelCapacity    batches the channel holds before producers block
 * @param flushEveryBatches  writer flushes all outputs after this many batches
 */
public record PipelineSettings(int workers, int batchSize, int channelCapacity, int flushEveryBatches) {
    public PipelineSettings {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
        }
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("channelCapacity must be >= 1: " + channelCapacity);
        }
        flushEveryBatches = Math.max(1, flushEveryBatches);
    }

    /**
     * @param threads          0 for host parallelism
     * @param channelCapacity  0 for {@code workers * CHANNEL_SLOTS_PER_WORKER}
     */
    public static PipelineSettings resolve(int threads, int batchSize, int channelCapacity, int flushEveryBatches) {
        int workers = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        int capacity = channelCapacity > 0
            ? channelCapacity
            : Math.min(ExtractorDefaults.MAX_CHANNEL_CAPACITY, workers * ExtractorDefaults.CHANNEL_SLOTS_PER_WORKER);
        return new PipelineSettings(workers, batchSize, capacity, flushEveryBatches);
    }

    /** Upper bound on records produced but not yet handed to the output. */
    public long maxInFlightRecords() {
        return (long) channelCapacity * batchSize + (long) workers * batchSize;
    }
}
