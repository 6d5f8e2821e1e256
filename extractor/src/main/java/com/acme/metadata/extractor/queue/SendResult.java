package com.acme.metadata.extractor.queue;

public sealed interface SendResult permits SendResult.Ok, SendResult.Closed {
    record Ok(long seq) implements SendResult {}
    record Closed() implements SendResult {}
}
