package com.acme.metadata.extractor.util;

/**
 * Default tuning constants for the extraction runtime.
 * <p>
 * Used when neither a command-line option nor the corresponding environment variable is set.
 */
public final class ExtractorDefaults {

    // ---- Worker pool ----
    public static final int AUTO_THREADS = 0;
    public static final int MAX_THREADS = 512;

    // ---- Batching / channel ----
    public static final int DEFAULT_BATCH_SIZE = 5_000;
    public static final int MAX_BATCH_SIZE = 1_000_000;
    public static final int CHANNEL_SLOTS_PER_WORKER = 4;
    public static final int MAX_CHANNEL_CAPACITY = 65_536;

    // ---- Output ----
    public static final int DEFAULT_MAX_OPEN_FILES = 100;
    public static final int MAX_OPEN_FILES_LIMIT = 16_384;
    public static final int DEFAULT_FLUSH_EVERY_BATCHES = 100;
    public static final String DEFAULT_OUTPUT = "field_data.csv";
    public static final String DEFAULT_FIELDS = "creators.name";

    // ---- Progress ----
    public static final int DEFAULT_PROGRESS_INTERVAL_SEC = 30;

    private ExtractorDefaults() {
    }
}
