package com.acme.metadata.extractor.pipeline;

import com.acme.metadata.extractor.output.OutputStrategy;
import com.acme.metadata.extractor.queue.BoundedChannel;
import com.acme.metadata.extractor.queue.ChannelClosedException;
import com.acme.metadata.extractor.telemetry.NoopPipelineMetrics;
import com.acme.metadata.extractor.telemetry.PipelineMetrics;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans input files over a fixed worker pool and funnels their batches through one bounded
 * channel into a single writer thread.
 *
 * <p>Shutdown is cooperative: once every file task has finished the channel is closed, the
 * writer drains it, flushes and closes all outputs, and is joined before the summary is built.</p>
 */
public final class ExtractionPipeline {
    private static final Logger LOG = Logger.getLogger(ExtractionPipeline.class.getName());

    private final JsonlFileProcessor processor;
    private final PipelineSettings settings;
    private final PipelineMetrics metrics;

    public ExtractionPipeline(JsonlFileProcessor processor, PipelineSettings settings, PipelineMetrics metrics) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    /**
     * Processes all files and writes their records to {@code output}, which is closed on return.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers
     */
    public RunSummary run(List<Path> files, OutputStrategy output) throws InterruptedException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(output, "output");
        long startNanos = System.nanoTime();

        BoundedChannel<RecordBatch> channel = new BoundedChannel<>(settings.channelCapacity());
        WriterTask writer = new WriterTask(channel, output, settings.flushEveryBatches(), metrics);
        Thread writerThread = new Thread(writer, "extract-writer");
        writerThread.start();
        LOG.info(() -> "Pipeline started files=" + files.size()
            + " workers=" + settings.workers()
            + " batchSize=" + settings.batchSize()
            + " channelCapacity=" + settings.channelCapacity()
            + " maxInFlightRecords=" + settings.maxInFlightRecords());

        AtomicBoolean writerGone = new AtomicBoolean(false);
        AtomicInteger workerIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(settings.workers(), r -> {
            Thread t = new Thread(r, "extract-worker-" + workerIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> processOne(file, channel, writerGone)));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i)));
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(30, TimeUnit.SECONDS);
            channel.close();
            writerThread.join();
        }

        return summarize(files.size(), outcomes, writer, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private FileOutcome processOne(Path file, BoundedChannel<RecordBatch> channel, AtomicBoolean writerGone) {
        if (writerGone.get()) {
            return new FileOutcome.Aborted(file, "writer disconnected before file was started");
        }
        FileOutcome outcome;
        try {
            outcome = processor.process(file, channel);
        } catch (ChannelClosedException e) {
            if (writerGone.compareAndSet(false, true)) {
                LOG.severe(e.getMessage());
            }
            outcome = new FileOutcome.Aborted(file, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = new FileOutcome.Aborted(file, "interrupted");
        }
        metrics.incFilesDone(outcome instanceof FileOutcome.Completed);
        return outcome;
    }

    private static FileOutcome await(Future<FileOutcome> future, Path file) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.log(Level.WARNING, "Worker crashed on " + file, e.getCause());
            return new FileOutcome.Failed(file, String.valueOf(e.getCause()));
        }
    }

    private static RunSummary summarize(int filesFound, List<FileOutcome> outcomes, WriterTask writer, Duration elapsed) {
        int succeeded = 0;
        int failed = 0;
        int aborted = 0;
        long lines = 0;
        long malformed = 0;
        long documents = 0;
        long records = 0;
        List<FileOutcome> failures = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome instanceof FileOutcome.Completed c) {
                succeeded++;
                lines += c.lines();
                malformed += c.malformedLines();
                documents += c.documents();
                records += c.records();
            } else if (outcome instanceof FileOutcome.Failed) {
                failed++;
                failures.add(outcome);
            } else {
                aborted++;
                failures.add(outcome);
            }
        }
        return new RunSummary(
            filesFound,
            succeeded,
            failed,
            aborted,
            lines,
            malformed,
            documents,
            records,
            writer.recordsWritten(),
            writer.batchesWritten(),
            elapsed,
            failures,
            writer.failure()
        );
    }
}
