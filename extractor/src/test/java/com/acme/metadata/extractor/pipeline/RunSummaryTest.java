package com.acme.metadata.extractor.pipeline;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunSummaryTest {

    @Test
    void shouldFormatElapsedTime() {
        assertEquals("4.567s", RunSummary.formatElapsed(Duration.ofMillis(4_567)));
        assertEquals("0.005s", RunSummary.formatElapsed(Duration.ofMillis(5)));
        assertEquals("2m 3s", RunSummary.formatElapsed(Duration.ofSeconds(123)));
        assertEquals("1h 2m 3s", RunSummary.formatElapsed(Duration.ofSeconds(3_723)));
    }

    @Test
    void shouldFailWhenEveryFileFailed() {
        RunSummary summary = summary(2, 0, 2, 0, null);

        assertTrue(summary.allFilesFailed());
        assertFalse(summary.isFatal());
        assertFalse(summary.isSuccess());
    }

    @Test
    void shouldSucceedWithPartialFailures() {
        assertTrue(summary(3, 2, 1, 0, null).isSuccess());
    }

    @Test
    void shouldBeFatalOnWriterError() {
        assertTrue(summary(3, 3, 0, 0, new IllegalStateException("disk full")).isFatal());
        assertTrue(summary(3, 2, 0, 1, null).isFatal());
    }

    private static RunSummary summary(int found, int ok, int failed, int aborted, Throwable fatal) {
        List<FileOutcome> failures = failed > 0
            ? List.of(new FileOutcome.Failed(Path.of("x.jsonl.gz"), "boom"))
            : List.of();
        return new RunSummary(found, ok, failed, aborted, 0, 0, 0, 0, 0, 0, Duration.ZERO, failures, fatal);
    }
}
