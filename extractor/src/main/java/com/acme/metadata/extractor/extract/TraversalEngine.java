package com.acme.metadata.extractor.extract;

import com.acme.metadata.extractor.plan.PlanNode;
import com.acme.metadata.extractor.plan.TraversalPlan;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Co-walks one parsed document and a {@link TraversalPlan}.
 *
 * <p>The walk uses an explicit stack so stack depth does not depend on document nesting.
 * Records come out in plan order: a node's own value first, then its literal children in
 * insertion order, then array elements by index. Missing keys, type mismatches and short
 * arrays produce nothing for that branch.</p>
 *
 * <p>Stateless and safe to share between workers.</p>
 */
public final class TraversalEngine {
    private final TraversalPlan plan;

    public TraversalEngine(TraversalPlan plan) {
        this.plan = Objects.requireNonNull(plan, "plan");
    }

    public TraversalPlan plan() {
        return plan;
    }

    public List<ExtractionRecord> extract(JsonNode document, String documentId, RoutingKey routingKey) {
        List<ExtractionRecord> out = new ArrayList<>();
        extractInto(document, documentId, routingKey, out);
        return out;
    }

    public void extractInto(JsonNode document, String documentId, RoutingKey routingKey, List<ExtractionRecord> out) {
        if (document == null) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(document, plan.root(), ""));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            JsonNode json = frame.json();
            PlanNode node = frame.node();

            if (node.isTerminal()) {
                out.add(new ExtractionRecord(
                    documentId,
                    routingKey,
                    node.terminalLabel(),
                    frame.path(),
                    ValueRenderer.render(json)
                ));
            }

            // pushed in reverse so that pops follow plan order
            PlanNode wildcard = node.wildcard();
            if (wildcard != null && json.isArray()) {
                for (int i = json.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(json.get(i), wildcard, frame.path() + "[" + i + "]"));
                }
            }
            if (json.isObject()) {
                List<PlanNode.Child> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    PlanNode.Child child = children.get(i);
                    JsonNode next = json.get(child.segment());
                    if (next != null) {
                        String path = frame.path().isEmpty()
                            ? child.segment()
                            : frame.path() + "." + child.segment();
                        stack.push(new Frame(next, child.node(), path));
                    }
                }
            }
        }
    }

    private record Frame(JsonNode json, PlanNode node, String path) {}
}
