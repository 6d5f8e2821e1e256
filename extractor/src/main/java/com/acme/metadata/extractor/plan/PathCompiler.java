package com.acme.metadata.extractor.plan;

import com.acme.metadata.extractor.schema.Schema;

import java.util.List;

/**
 * Compiles requested dotted field paths (e.g. {@code "creators.affiliation.name"})
 * into one shared traversal plan.
 *
 * <p>Implementations are pure: the same specs and schema always yield a structurally equal plan.</p>
 */
public interface PathCompiler {
    /**
     * Compiles all specs into a single plan.
     *
     * @param specs   requested fields, in output order
     * @param schema  array prefixes used to insert implicit array steps
     * @return the compilation result; {@link CompileResult.Failure#position()} is the index of the offending spec
     */
    CompileResult compile(List<FieldSpec> specs, Schema schema);
}
