package com.acme.metadata.extractor.output;

public enum HandleState {
    OPEN, FLUSHED, CLOSED
}
