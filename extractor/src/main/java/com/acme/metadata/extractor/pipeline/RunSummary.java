package com.acme.metadata.extractor.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Final report of one run.
 *
 * @param fatalError writer or channel failure that aborted the run, or {@code null}
 */
public record RunSummary(
    int filesFound,
    int filesSucceeded,
    int filesFailed,
    int filesAborted,
    long linesRead,
    long malformedLines,
    long documentsExtracted,
    long recordsExtracted,
    long recordsWritten,
    long batchesWritten,
    Duration elapsed,
    List<FileOutcome> failures,
    Throwable fatalError
) {
    public RunSummary {
        failures = List.copyOf(failures);
    }

    public boolean isFatal() {
        return fatalError != null || filesAborted > 0;
    }

    public boolean allFilesFailed() {
        return filesFound > 0 && filesSucceeded == 0;
    }

    public boolean isSuccess() {
        return !isFatal() && !allFilesFailed();
    }

    /** {@code 1h 2m 3s}, {@code 2m 3s} or {@code 4.567s}. */
    public static String formatElapsed(Duration elapsed) {
        long secs = elapsed.getSeconds();
        if (secs >= 3600) {
            return (secs / 3600) + "h " + ((secs % 3600) / 60) + "m " + (secs % 60) + "s";
        }
        if (secs >= 60) {
            return (secs / 60) + "m " + (secs % 60) + "s";
        }
        return String.format(Locale.ROOT, "%d.%03ds", secs, elapsed.toMillisPart());
    }
}
