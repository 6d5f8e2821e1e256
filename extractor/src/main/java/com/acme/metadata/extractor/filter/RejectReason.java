package com.acme.metadata.extractor.filter;

public enum RejectReason {
    CATEGORY_NOT_ALLOWED, REQUIRED_VALUE_MISSING, EXCLUDED_FIELD_PRESENT, ROUTING_MISMATCH, INCOMPLETE_FIELDS
}
