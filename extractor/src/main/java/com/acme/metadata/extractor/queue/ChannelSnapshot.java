package com.acme.metadata.extractor.queue;

public record ChannelSnapshot(
    int depth,
    int capacity,
    long sent,
    long received,
    boolean closed
) {}
