package com.acme.metadata.extractor.plan;

import java.util.List;

/**
 * Immutable trie node of a {@link TraversalPlan}.
 *
 * @param terminalLabel  label of the spec ending exactly here, or {@code null}
 * @param children       literal children in insertion order
 * @param wildcard       array-expansion child, or {@code null}
 */
public record PlanNode(String terminalLabel, List<Child> children, PlanNode wildcard) {
    public PlanNode {
        children = List.copyOf(children);
    }

    public boolean isTerminal() {
        return terminalLabel != null;
    }

    public boolean isLeaf() {
        return children.isEmpty() && wildcard == null;
    }

    public record Child(String segment, PlanNode node) {}
}
