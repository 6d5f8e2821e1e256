package com.acme.metadata.extractor.plan;

import com.acme.metadata.extractor.schema.Schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a prefix trie from the requested specs, stepping into an implicit wildcard node
 * whenever the cumulative dotted path is a schema array prefix. This lets
 * {@code creators.affiliation.name} expand as {@code creators[].affiliation[].name}
 * without the caller writing array syntax.
 */
public final class TriePathCompiler implements PathCompiler {

    @Override
    public CompileResult compile(List<FieldSpec> specs, Schema schema) {
        if (specs == null || specs.isEmpty()) {
            return new CompileResult.Failure("EMPTY_FIELDS", "no field specs given", 0);
        }
        if (schema == null) {
            return new CompileResult.Failure("NO_SCHEMA", "schema is required", 0);
        }

        MutableNode root = new MutableNode();
        for (int i = 0; i < specs.size(); i++) {
            FieldSpec spec = specs.get(i);
            if (spec == null || spec.segments().isEmpty()) {
                return new CompileResult.Failure("EMPTY_SPEC", "field spec #" + i + " has no segments", i);
            }
            MutableNode current = root;
            StringBuilder cumulative = new StringBuilder();
            for (String segment : spec.segments()) {
                if (segment == null || segment.isBlank()) {
                    return new CompileResult.Failure("EMPTY_SEGMENT",
                        "empty segment in field spec '" + spec.dottedPath() + "'", i);
                }
                if (cumulative.length() > 0) {
                    cumulative.append('.');
                }
                cumulative.append(segment);
                current = current.child(segment);
                if (schema.isArray(cumulative.toString())) {
                    current = current.wildcard();
                }
            }
            // first spec to reach a node owns its label
            if (current.terminalLabel == null) {
                current.terminalLabel = spec.label();
            }
        }
        return new CompileResult.Success(new TraversalPlan(root.freeze(), specs));
    }

    private static final class MutableNode {
        private final Map<String, MutableNode> children = new LinkedHashMap<>();
        private MutableNode wildcard;
        private String terminalLabel;

        MutableNode child(String segment) {
            return children.computeIfAbsent(segment, ignored -> new MutableNode());
        }

        MutableNode wildcard() {
            if (wildcard == null) {
                wildcard = new MutableNode();
            }
            return wildcard;
        }

        PlanNode freeze() {
            List<PlanNode.Child> frozen = new ArrayList<>(children.size());
            for (Map.Entry<String, MutableNode> e : children.entrySet()) {
                frozen.add(new PlanNode.Child(e.getKey(), e.getValue().freeze()));
            }
            return new PlanNode(terminalLabel, frozen, wildcard == null ? null : wildcard.freeze());
        }
    }
}
