package com.acme.metadata.extractor.filter;

import com.acme.metadata.extractor.extract.RoutingKey;

/**
 * Optional provider/client restriction. A {@code null} side matches everything.
 */
public record RoutingFilter(String providerId, String clientId) {
    public static final RoutingFilter ANY = new RoutingFilter(null, null);

    public boolean matches(RoutingKey key) {
        if (providerId != null && !providerId.equals(key.providerId())) {
            return false;
        }
        return clientId == null || clientId.equals(key.clientId());
    }

    public boolean isUnrestricted() {
        return providerId == null && clientId == null;
    }
}
