package com.acme.metadata.extractor.filter;

import com.acme.metadata.extractor.extract.ExtractionRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Post-extraction gate: keeps a document's records only if at least as many distinct labels
 * were observed as were requested.
 *
 * <p>This compares counts, not label sets.</p>
 */
public final class CompletenessGate {
    private final int requiredLabelCount;

    public CompletenessGate(Set<String> requestedLabels) {
        this.requiredLabelCount = requestedLabels.size();
    }

    public boolean isComplete(List<ExtractionRecord> records) {
        if (records.isEmpty()) {
            return false;
        }
        Set<String> observed = new HashSet<>();
        for (ExtractionRecord record : records) {
            observed.add(record.fieldLabel());
        }
        return observed.size() >= requiredLabelCount;
    }
}
