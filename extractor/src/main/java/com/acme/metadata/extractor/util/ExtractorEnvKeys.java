package com.acme.metadata.extractor.util;

/**
 * Canonical environment variable names consulted when a tuning option is not given on the command line.
 */
public final class ExtractorEnvKeys {
    public static final String EXTRACTOR_THREADS = "EXTRACTOR_THREADS";
    public static final String EXTRACTOR_BATCH_SIZE = "EXTRACTOR_BATCH_SIZE";
    public static final String EXTRACTOR_CHANNEL_CAPACITY = "EXTRACTOR_CHANNEL_CAPACITY";
    public static final String EXTRACTOR_MAX_OPEN_FILES = "EXTRACTOR_MAX_OPEN_FILES";
    public static final String EXTRACTOR_FLUSH_EVERY_BATCHES = "EXTRACTOR_FLUSH_EVERY_BATCHES";
    public static final String EXTRACTOR_PROGRESS_INTERVAL_SEC = "EXTRACTOR_PROGRESS_INTERVAL_SEC";

    private ExtractorEnvKeys() {
    }
}
