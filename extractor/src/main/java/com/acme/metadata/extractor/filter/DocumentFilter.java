package com.acme.metadata.extractor.filter;

import com.acme.metadata.extractor.extract.RoutingKey;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pre-extraction admission: category allow-list, then every required-value predicate,
 * then every non-existence predicate, then the routing filter. First failure wins.
 */
public final class DocumentFilter {
    private final List<DocumentPredicate> predicates;
    private final RoutingFilter routing;

    public DocumentFilter(FilterConfig config) {
        Objects.requireNonNull(config, "config");
        List<DocumentPredicate> ordered = new ArrayList<>();
        if (!config.allowedCategories().isEmpty()) {
            ordered.add(new CategoryAllowList(config.allowedCategories()));
        }
        ordered.addAll(config.requiredValues());
        ordered.addAll(config.exclusions());
        this.predicates = List.copyOf(ordered);
        this.routing = config.routing();
    }

    public FilterDecision evaluate(JsonNode attributes, RoutingKey key) {
        for (DocumentPredicate predicate : predicates) {
            if (!predicate.test(attributes)) {
                return new FilterDecision.Reject(predicate.rejectReason(), predicate.toString());
            }
        }
        if (!routing.matches(key)) {
            return new FilterDecision.Reject(RejectReason.ROUTING_MISMATCH, key.toString());
        }
        return FilterDecision.ADMIT;
    }

    public boolean isPassThrough() {
        return predicates.isEmpty() && routing.isUnrestricted();
    }
}
