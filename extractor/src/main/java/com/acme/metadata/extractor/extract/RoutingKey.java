package com.acme.metadata.extractor.extract;

import java.util.Objects;

/**
 * Owning provider and client of a document; selects the output destination.
 */
public record RoutingKey(String providerId, String clientId) {
    public RoutingKey {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(clientId, "clientId");
    }
}
