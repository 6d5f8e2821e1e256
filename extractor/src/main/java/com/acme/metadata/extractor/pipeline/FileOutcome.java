package com.acme.metadata.extractor.pipeline;

import java.nio.file.Path;

public sealed interface FileOutcome permits FileOutcome.Completed, FileOutcome.Failed, FileOutcome.Aborted {
    Path file();

    record Completed(Path file, long lines, long malformedLines, long documents, long records) implements FileOutcome {}

    /** The file could not be opened or decoded; unsent records from it were dropped. */
    record Failed(Path file, String error) implements FileOutcome {}

    /** The writer went away before this file's records could be delivered. */
    record Aborted(Path file, String error) implements FileOutcome {}
}
