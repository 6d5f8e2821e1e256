package com.acme.metadata.extractor.filter;

public sealed interface FilterDecision permits FilterDecision.Admit, FilterDecision.Reject {
    FilterDecision ADMIT = new Admit();

    record Admit() implements FilterDecision {}
    record Reject(RejectReason reason, String detail) implements FilterDecision {}
}
