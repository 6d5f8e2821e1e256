package com.acme.metadata.extractor.queue;

/**
 * Thrown to a producer whose batch can no longer be delivered because the consumer side is gone.
 */
public final class ChannelClosedException extends RuntimeException {
    public ChannelClosedException(String message) {
        super(message);
    }
}
