package com.acme.metadata.extractor.plan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled prefix trie over all requested field specs. Immutable and shared by every worker.
 */
public final class TraversalPlan {
    private final PlanNode root;
    private final List<FieldSpec> specs;
    private final Set<String> requestedLabels;

    TraversalPlan(PlanNode root, List<FieldSpec> specs) {
        this.root = Objects.requireNonNull(root, "root");
        this.specs = List.copyOf(specs);
        this.requestedLabels = Set.copyOf(FieldSpecParser.labels(specs));
    }

    public PlanNode root() {
        return root;
    }

    public List<FieldSpec> specs() {
        return specs;
    }

    public Set<String> requestedLabels() {
        return requestedLabels;
    }

    public int nodeCount() {
        int count = 0;
        Deque<PlanNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            PlanNode node = stack.pop();
            count++;
            for (PlanNode.Child child : node.children()) {
                stack.push(child.node());
            }
            if (node.wildcard() != null) {
                stack.push(node.wildcard());
            }
        }
        return count;
    }

    /** Structural equality of the trie; spec order is not compared. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraversalPlan other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "TraversalPlan{specs=" + specs.size() + ", nodes=" + nodeCount() + "}";
    }
}
