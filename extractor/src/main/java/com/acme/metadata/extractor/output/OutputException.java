package com.acme.metadata.extractor.output;

import java.nio.file.Path;

/**
 * Fatal failure to open, write, flush or close an output destination.
 */
public final class OutputException extends RuntimeException {
    private final Path destination;

    public OutputException(Path destination, String message, Throwable cause) {
        super(message + ": " + destination, cause);
        this.destination = destination;
    }

    public Path destination() {
        return destination;
    }
}
